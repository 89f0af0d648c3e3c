package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.Metric;

import java.util.Comparator;

/**
 * Orderings shared by the in-memory backend. Ties break on the canonical id string so
 * that pages line up with the ClickHouse queries, which sort on {@code toString(id)}.
 */
final class RepositoryOrdering {

    static final Comparator<Document> DOCUMENTS_NEWEST_FIRST =
        Comparator.comparing(Document::uploadTime).reversed()
            .thenComparing(d -> d.id().toString());

    static final Comparator<Finding> FINDINGS_MOST_CONFIDENT_FIRST =
        Comparator.comparingDouble(Finding::confidence).reversed()
            .thenComparing(f -> f.id().toString());

    static final Comparator<Metric> METRICS_NEWEST_FIRST =
        Comparator.comparing(Metric::timestamp).reversed()
            .thenComparing(m -> m.id().toString());

    private RepositoryOrdering() {
    }
}
