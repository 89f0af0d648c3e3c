package com.nevis.pdfscan.service;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.Page;
import com.nevis.pdfscan.model.PageRequest;

import java.util.OptionalDouble;

public interface MetricsService {
    Page<Metric> getMetrics(MetricFilter filter, PageRequest page);
    OptionalDouble averageDuration(MetricFilter filter);
}
