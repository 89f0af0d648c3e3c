package com.nevis.pdfscan.model;

import java.util.Objects;

public record FindingCandidate(FindingType findingType, String location, double confidence) {

    public FindingCandidate {
        Objects.requireNonNull(findingType, "findingType");
        Objects.requireNonNull(location, "location");
        checkConfidence(confidence);
    }

    static void checkConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0.0, 1.0], got " + confidence);
        }
    }
}
