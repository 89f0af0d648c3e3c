package com.nevis.pdfscan.model;

import java.util.List;

public record Page<T>(List<T> items, int limit, int offset, long total) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> of(List<T> items, PageRequest request, long total) {
        return new Page<>(items, request.limit(), request.offset(), total);
    }

    public int returned() {
        return items.size();
    }
}
