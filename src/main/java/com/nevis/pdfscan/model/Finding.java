package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * A located, typed match. The matched text itself is never part of a finding.
 */
public record Finding(
    UUID id,

    @JsonProperty("document_id")
    UUID documentId,

    @JsonProperty("finding_type")
    FindingType findingType,

    String location,

    double confidence,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {

    public Finding {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(findingType, "findingType");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(createdAt, "createdAt");
        FindingCandidate.checkConfidence(confidence);
    }

    public static Finding from(FindingCandidate candidate, UUID documentId, Clock clock) {
        return new Finding(
            UUID.randomUUID(),
            documentId,
            candidate.findingType(),
            candidate.location(),
            candidate.confidence(),
            OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS)
        );
    }
}
