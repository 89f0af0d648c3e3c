package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record Metric(
    UUID id,

    String operation,

    @JsonProperty("duration_ms")
    double durationMs,

    OffsetDateTime timestamp,

    @JsonProperty("document_id")
    UUID documentId,

    Map<String, Object> metadata
) {

    public static final String UPLOAD = "upload";
    public static final String SCAN = "scan";

    public Metric {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Metric create(String operation, double durationMs, UUID documentId,
                                Map<String, Object> metadata, Clock clock) {
        return new Metric(
            UUID.randomUUID(),
            operation,
            durationMs,
            OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS),
            documentId,
            metadata
        );
    }
}
