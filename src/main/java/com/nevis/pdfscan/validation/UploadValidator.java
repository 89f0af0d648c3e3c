package com.nevis.pdfscan.validation;

import com.nevis.pdfscan.config.UploadProperties;
import com.nevis.pdfscan.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Rejects uploads that are not PDF documents or fall outside the size ceiling.
 * Checks run in order and the first failure wins.
 */
@Component
@RequiredArgsConstructor
public class UploadValidator {

    static final Set<String> ALLOWED_CONTENT_TYPES = Set.of("application/pdf");
    static final String ALLOWED_EXTENSION = ".pdf";

    private final UploadProperties uploadProperties;

    public void validate(String filename, String contentType, long size) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException(ValidationException.MISSING_FILENAME, "Filename is required");
        }
        if (!filename.toLowerCase(Locale.ROOT).endsWith(ALLOWED_EXTENSION)) {
            throw new ValidationException(ValidationException.INVALID_FILE_TYPE,
                "Invalid file type. Only PDF files are allowed.");
        }
        if (contentType != null && !ALLOWED_CONTENT_TYPES.contains(contentType)) {
            throw new ValidationException(ValidationException.INVALID_CONTENT_TYPE,
                "Invalid content type: %s. Expected: %s".formatted(contentType, String.join(", ", ALLOWED_CONTENT_TYPES)));
        }
        if (size == 0) {
            throw new ValidationException(ValidationException.EMPTY_FILE, "File is empty");
        }

        long maxBytes = uploadProperties.maxFileSize().toBytes();
        if (size > maxBytes) {
            throw new ValidationException(ValidationException.FILE_TOO_LARGE,
                "File size (%d bytes) exceeds maximum allowed size of %d bytes.".formatted(size, maxBytes));
        }
    }
}
