package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.scanner.DocumentScanner;

import java.util.Objects;

/**
 * The repositories and scanner one running instance works with. Built once at startup
 * by {@link BackendFactory}; the three repositories always come from the same backend.
 */
public record Backends(
    DocumentRepository document,
    FindingRepository finding,
    MetricsRepository metrics,
    DocumentScanner scanner
) {

    public Backends {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(finding, "finding");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(scanner, "scanner");
    }

    @Override
    public String toString() {
        return "Backends(document=%s, finding=%s, metrics=%s, scanner=%s)".formatted(
            document.getClass().getSimpleName(),
            finding.getClass().getSimpleName(),
            metrics.getClass().getSimpleName(),
            scanner.getClass().getSimpleName()
        );
    }
}
