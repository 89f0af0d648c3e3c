package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Sensitive-data categories the scanner can report. Adding a category means adding
 * a constant here and registering a matcher for it.
 */
public enum FindingType {
    SSN("ssn"),
    EMAIL("email");

    private final String tag;

    FindingType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static FindingType fromTag(String tag) {
        return Arrays.stream(values())
            .filter(t -> t.tag.equalsIgnoreCase(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown finding type: " + tag));
    }
}
