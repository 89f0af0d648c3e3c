package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DocumentStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String tag;

    DocumentStatus(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public boolean isTerminal() {
        return switch (this) {
            case PENDING, PROCESSING -> false;
            case COMPLETED, FAILED -> true;
        };
    }

    /**
     * A document moves forward only: pending to processing, then processing to
     * one terminal status. Pending may also fail directly when staging breaks.
     */
    public boolean canTransitionTo(DocumentStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public static DocumentStatus fromTag(String tag) {
        return Arrays.stream(values())
            .filter(s -> s.tag.equalsIgnoreCase(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown document status: " + tag));
    }
}
