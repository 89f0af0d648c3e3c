package com.nevis.pdfscan.exception;

/**
 * The extractor could not open the document: encrypted, corrupt or not a PDF at all.
 */
public class DocumentUnreadableException extends RuntimeException {

    public DocumentUnreadableException(String message) {
        super(message);
    }

    public DocumentUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
