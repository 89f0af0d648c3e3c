package com.nevis.pdfscan.model;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Optional metric filters; a null field does not filter. Time bounds are inclusive.
 */
@Builder
public record MetricFilter(
    String operation,
    UUID documentId,
    OffsetDateTime start,
    OffsetDateTime end
) {

    public static MetricFilter all() {
        return new MetricFilter(null, null, null, null);
    }

    public static MetricFilter forOperation(String operation) {
        return new MetricFilter(operation, null, null, null);
    }

    public boolean matches(Metric metric) {
        return (operation == null || operation.equals(metric.operation()))
            && (documentId == null || documentId.equals(metric.documentId()))
            && (start == null || !metric.timestamp().isBefore(start))
            && (end == null || !metric.timestamp().isAfter(end));
    }
}
