package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.FindingType;

public interface PatternMatcher {

    FindingType type();

    /**
     * Confidence attached to every match; exact pattern matchers report 1.0.
     */
    double confidence();

    /**
     * Number of occurrences in {@code text}.
     */
    int countMatches(String text);
}
