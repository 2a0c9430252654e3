package com.linkshelf.refresh.model;

public enum FailureSource {
    PAGE,
    GITHUB
}
