package com.nevis.pdfscan.service;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.Page;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.repository.BackendFactory;
import com.nevis.pdfscan.repository.Backends;
import com.nevis.pdfscan.scanner.PatternRegistry;
import com.nevis.pdfscan.scanner.RegexDocumentScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsServiceImplTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private Backends backends;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        backends = BackendFactory.inMemory(new RegexDocumentScanner(PatternRegistry.defaults()));
        metricsService = new MetricsServiceImpl(backends);
    }

    private void storeMetric(String operation, double durationMs, OffsetDateTime timestamp) {
        backends.metrics().save(new Metric(UUID.randomUUID(), operation, durationMs, timestamp, UUID.randomUUID(), Map.of()));
    }

    @Test
    @DisplayName("Should report no average when nothing was recorded")
    void averageDuration_ShouldBeEmpty_WithoutData() {
        assertThat(metricsService.averageDuration(MetricFilter.forOperation(Metric.UPLOAD))).isEmpty();
        assertThat(metricsService.averageDuration(MetricFilter.all())).isEmpty();
    }

    @Test
    @DisplayName("Should average only the requested operation")
    void averageDuration_ShouldFilterByOperation() {
        storeMetric(Metric.SCAN, 10.0, T0);
        storeMetric(Metric.SCAN, 20.0, T0.plusMinutes(1));
        storeMetric(Metric.UPLOAD, 500.0, T0);

        OptionalDouble average = metricsService.averageDuration(MetricFilter.forOperation(Metric.SCAN));

        assertThat(average).hasValue(15.0);
    }

    @Test
    @DisplayName("Should treat time bounds as inclusive")
    void getMetrics_ShouldApplyInclusiveBounds() {
        storeMetric(Metric.SCAN, 1.0, T0.minusSeconds(1));
        storeMetric(Metric.SCAN, 2.0, T0);
        storeMetric(Metric.SCAN, 3.0, T0.plusMinutes(5));
        storeMetric(Metric.SCAN, 4.0, T0.plusMinutes(6));

        MetricFilter window = MetricFilter.builder().start(T0).end(T0.plusMinutes(5)).build();
        Page<Metric> page = metricsService.getMetrics(window, PageRequest.firstPage());

        assertThat(page.items()).extracting(Metric::durationMs).containsExactly(3.0, 2.0);
        assertThat(page.total()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject a window that ends before it starts")
    void getMetrics_ShouldRejectInvertedWindow() {
        MetricFilter inverted = MetricFilter.builder().start(T0).end(T0.minusHours(1)).build();

        assertThatThrownBy(() -> metricsService.getMetrics(inverted, PageRequest.firstPage()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> metricsService.averageDuration(inverted))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
