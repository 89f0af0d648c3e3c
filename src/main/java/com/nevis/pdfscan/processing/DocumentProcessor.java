package com.nevis.pdfscan.processing;

import com.nevis.pdfscan.exception.StorageException;
import com.nevis.pdfscan.model.ProcessingResult;

public interface DocumentProcessor {

    /**
     * Runs one upload through the pipeline: store the document, stage the bytes, scan,
     * store findings and settle the document in a terminal status.
     * <p>
     * Input is expected to be validated already. Scan failures are reported through a
     * {@code failed} result, never thrown.
     *
     * @throws StorageException when the initial document record cannot be written
     */
    ProcessingResult processUpload(byte[] content, String filename, long declaredSize);
}
