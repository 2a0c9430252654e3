package com.linkshelf.refresh.model;

import java.util.Locale;

public enum LinkStatus {
    ACTIVE("active"),
    ARCHIVED("archived"),
    INACCESSIBLE("inaccessible"),
    REPO_UNAVAILABLE("repo_unavailable");

    private final String dbValue;

    LinkStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isUnreachable() {
        return this == INACCESSIBLE || this == REPO_UNAVAILABLE;
    }

    public static LinkStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Link status is blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LinkStatus status : values()) {
            if (status.dbValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown link status: " + value);
    }
}
