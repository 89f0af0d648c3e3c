package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.Page;

import java.util.List;

public record PageResponse<T>(List<T> items, Pagination pagination) {

    public record Pagination(int limit, int offset, long total, int returned) {}

    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(
            page.items(),
            new Pagination(page.limit(), page.offset(), page.total(), page.returned())
        );
    }
}
