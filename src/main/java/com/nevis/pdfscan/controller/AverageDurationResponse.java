package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code averageDurationMs} is null when no metric matched.
 */
public record AverageDurationResponse(
    String operation,

    @JsonProperty("average_duration_ms")
    Double averageDurationMs
) {}
