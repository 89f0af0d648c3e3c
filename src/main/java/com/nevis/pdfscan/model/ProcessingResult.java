package com.nevis.pdfscan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ProcessingResult(
    @JsonProperty("document_id")
    UUID documentId,

    String filename,

    DocumentStatus status,

    @JsonProperty("upload_time")
    OffsetDateTime uploadTime,

    @JsonProperty("file_size")
    long fileSize,

    @JsonProperty("findings_count")
    int findingsCount,

    @JsonProperty("error_message")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String errorMessage
) {

    public static ProcessingResult of(Document document, int findingsCount) {
        return new ProcessingResult(
            document.id(),
            document.filename(),
            document.status(),
            document.uploadTime(),
            document.fileSize(),
            findingsCount,
            document.errorMessage()
        );
    }
}
