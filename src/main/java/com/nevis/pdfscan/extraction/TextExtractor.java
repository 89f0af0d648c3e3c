package com.nevis.pdfscan.extraction;

import com.nevis.pdfscan.exception.DocumentUnreadableException;

import java.util.List;

public interface TextExtractor {

    /**
     * Returns the text of every page, in page order.
     *
     * @throws DocumentUnreadableException when the document is encrypted, corrupt or not parseable
     */
    List<String> extractPages(byte[] content);
}
