package com.linkshelf.refresh.model;

public record DatabaseHealthResponse(
    String status,
    boolean connected
) {
}
