package com.linkshelf.refresh.model;

public record PageMetadata(
    String title,
    String description,
    String logo
) {
    public static PageMetadata empty() {
        return new PageMetadata(null, null, null);
    }
}
