package com.nevis.pdfscan.exception;

import lombok.Getter;

@Getter
public class ValidationException extends RuntimeException {

    public static final String MISSING_FILENAME = "MISSING_FILENAME";
    public static final String INVALID_FILE_TYPE = "INVALID_FILE_TYPE";
    public static final String INVALID_CONTENT_TYPE = "INVALID_CONTENT_TYPE";
    public static final String EMPTY_FILE = "EMPTY_FILE";
    public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
    public static final String FILE_READ_ERROR = "FILE_READ_ERROR";

    private final String code;

    public ValidationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
