package com.linkshelf.refresh.model;

public enum SchedulerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
