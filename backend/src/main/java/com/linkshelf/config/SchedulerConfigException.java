package com.linkshelf.config;

public class SchedulerConfigException extends RuntimeException {
    public SchedulerConfigException(String message) {
        super(message);
    }
}
