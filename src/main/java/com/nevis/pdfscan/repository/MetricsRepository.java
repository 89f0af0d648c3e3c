package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.PageRequest;

import java.util.List;
import java.util.OptionalDouble;

public interface MetricsRepository {
    Metric save(Metric metric);
    List<Metric> find(MetricFilter filter, PageRequest page);
    long count(MetricFilter filter);

    /**
     * Mean duration of the metrics matching {@code filter}; the document id is ignored.
     * Empty when nothing matches.
     */
    OptionalDouble averageDuration(MetricFilter filter);
}
