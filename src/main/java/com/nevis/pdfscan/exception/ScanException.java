package com.nevis.pdfscan.exception;

/**
 * Extraction or scanning failed for the whole document. The processor records it on the
 * document instead of rethrowing.
 */
public class ScanException extends RuntimeException {

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
