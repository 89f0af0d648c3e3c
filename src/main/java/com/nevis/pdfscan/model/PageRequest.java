package com.nevis.pdfscan.model;

public record PageRequest(int limit, int offset) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public PageRequest {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got " + offset);
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static PageRequest of(int limit, int offset) {
        return new PageRequest(limit, offset);
    }

    public static PageRequest firstPage() {
        return new PageRequest(DEFAULT_LIMIT, 0);
    }
}
