package com.nevis.pdfscan.service;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.Page;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.repository.Backends;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

@Service
@RequiredArgsConstructor
public class MetricsServiceImpl implements MetricsService {

    private final Backends backends;

    @Override
    public Page<Metric> getMetrics(MetricFilter filter, PageRequest page) {
        checkRange(filter);
        return Page.of(backends.metrics().find(filter, page), page, backends.metrics().count(filter));
    }

    @Override
    public OptionalDouble averageDuration(MetricFilter filter) {
        checkRange(filter);
        return backends.metrics().averageDuration(filter);
    }

    private static void checkRange(MetricFilter filter) {
        if (filter.start() != null && filter.end() != null && filter.start().isAfter(filter.end())) {
            throw new IllegalArgumentException("start must not be after end");
        }
    }
}
