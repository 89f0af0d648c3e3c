package com.nevis.pdfscan.exception;

/**
 * A repository write failed. Fatal to the current request; never retried by the pipeline.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
