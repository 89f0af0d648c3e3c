package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

public record Document(
    UUID id,

    String filename,

    @JsonProperty("upload_time")
    OffsetDateTime uploadTime,

    DocumentStatus status,

    @JsonProperty("file_size")
    long fileSize,

    @JsonProperty("error_message")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String errorMessage
) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(uploadTime, "uploadTime");
        Objects.requireNonNull(status, "status");
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize must not be negative");
        }
        boolean hasError = errorMessage != null && !errorMessage.isBlank();
        if (status == DocumentStatus.FAILED && !hasError) {
            throw new IllegalArgumentException("A failed document requires an error message");
        }
        if (status != DocumentStatus.FAILED && errorMessage != null) {
            throw new IllegalArgumentException("Only a failed document may carry an error message");
        }
    }

    public static Document create(String filename, long fileSize, Clock clock) {
        return new Document(
            UUID.randomUUID(),
            filename,
            OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS),
            DocumentStatus.PENDING,
            fileSize,
            null
        );
    }

    public Document withStatus(DocumentStatus newStatus, String newErrorMessage) {
        return new Document(id, filename, uploadTime, newStatus, fileSize, newErrorMessage);
    }
}
