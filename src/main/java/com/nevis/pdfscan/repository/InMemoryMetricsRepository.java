package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.PageRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local metrics store. No retention policy: metrics live until restart.
 */
public class InMemoryMetricsRepository implements MetricsRepository {

    private final List<Metric> metrics = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Metric save(Metric metric) {
        lock.writeLock().lock();
        try {
            metrics.add(metric);
            return metric;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Metric> find(MetricFilter filter, PageRequest page) {
        lock.readLock().lock();
        try {
            return metrics.stream()
                .filter(filter::matches)
                .sorted(RepositoryOrdering.METRICS_NEWEST_FIRST)
                .skip(page.offset())
                .limit(page.limit())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count(MetricFilter filter) {
        lock.readLock().lock();
        try {
            return metrics.stream().filter(filter::matches).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public OptionalDouble averageDuration(MetricFilter filter) {
        MetricFilter ignoringDocument = new MetricFilter(filter.operation(), null, filter.start(), filter.end());
        lock.readLock().lock();
        try {
            return metrics.stream()
                .filter(ignoringDocument::matches)
                .mapToDouble(Metric::durationMs)
                .average();
        } finally {
            lock.readLock().unlock();
        }
    }
}
