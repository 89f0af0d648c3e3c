package com.nevis.pdfscan.processing;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Upload bytes written to a temporary file for the duration of one scan. Closing deletes the file.
 */
@Slf4j
final class StagedUpload implements AutoCloseable {

    private final Path path;

    private StagedUpload(Path path) {
        this.path = path;
    }

    static StagedUpload stage(byte[] content, UUID documentId, Path directory) throws IOException {
        String prefix = "pdf_scan_" + documentId + "_";
        Path path = directory == null
            ? Files.createTempFile(prefix, ".pdf")
            : Files.createTempFile(directory, prefix, ".pdf");
        try {
            Files.write(path, content);
        } catch (IOException e) {
            Files.deleteIfExists(path);
            throw e;
        }
        return new StagedUpload(path);
    }

    byte[] read() throws IOException {
        return Files.readAllBytes(path);
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete staged upload {}: {}", path, e.getMessage());
        }
    }
}
