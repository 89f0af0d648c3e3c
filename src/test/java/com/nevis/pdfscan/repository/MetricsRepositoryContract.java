package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.PageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

interface MetricsRepositoryContract {

    // recent enough to stay clear of the ClickHouse retention TTL
    OffsetDateTime T0 = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS).minusHours(1);

    MetricsRepository metricsRepository();

    private static Metric metric(String operation, double durationMs, OffsetDateTime timestamp, UUID documentId) {
        return new Metric(UUID.randomUUID(), operation, durationMs, timestamp, documentId, Map.of("findings_count", 2));
    }

    @Test
    @DisplayName("Should read back metrics with their metadata")
    default void save_ShouldRoundTrip() {
        Metric metric = metric(Metric.SCAN, 12.5, T0.plusNanos(7_000_000), UUID.randomUUID());

        metricsRepository().save(metric);

        assertThat(metricsRepository().find(MetricFilter.all(), PageRequest.firstPage())).containsExactly(metric);
    }

    @Test
    @DisplayName("Should keep metrics without a document")
    default void save_ShouldAllowMissingDocument() {
        Metric metric = metric(Metric.UPLOAD, 3.0, T0, null);

        metricsRepository().save(metric);

        assertThat(metricsRepository().find(MetricFilter.all(), PageRequest.firstPage()))
            .singleElement()
            .extracting(Metric::documentId)
            .isNull();
    }

    @Test
    @DisplayName("Should filter by operation, document and inclusive time window")
    default void find_ShouldApplyFilters() {
        UUID documentId = UUID.randomUUID();
        Metric early = metric(Metric.SCAN, 1.0, T0, documentId);
        Metric late = metric(Metric.SCAN, 2.0, T0.plusMinutes(10), documentId);
        Metric upload = metric(Metric.UPLOAD, 3.0, T0.plusMinutes(5), documentId);
        Metric other = metric(Metric.SCAN, 4.0, T0.plusMinutes(5), UUID.randomUUID());
        metricsRepository().save(early);
        metricsRepository().save(late);
        metricsRepository().save(upload);
        metricsRepository().save(other);

        MetricFilter scansOfDocument = MetricFilter.builder().operation(Metric.SCAN).documentId(documentId).build();
        assertThat(metricsRepository().find(scansOfDocument, PageRequest.firstPage()))
            .extracting(Metric::id)
            .containsExactly(late.id(), early.id());
        assertThat(metricsRepository().count(scansOfDocument)).isEqualTo(2);

        MetricFilter window = MetricFilter.builder().start(T0.plusMinutes(5)).end(T0.plusMinutes(10)).build();
        assertThat(metricsRepository().count(window)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should average durations and report nothing without data")
    default void averageDuration_ShouldAverageMatches() {
        assertThat(metricsRepository().averageDuration(MetricFilter.forOperation(Metric.SCAN))).isEmpty();

        metricsRepository().save(metric(Metric.SCAN, 10.0, T0, UUID.randomUUID()));
        metricsRepository().save(metric(Metric.SCAN, 30.0, T0.plusSeconds(1), UUID.randomUUID()));
        metricsRepository().save(metric(Metric.UPLOAD, 100.0, T0, UUID.randomUUID()));

        assertThat(metricsRepository().averageDuration(MetricFilter.forOperation(Metric.SCAN))).hasValue(20.0);
        assertThat(metricsRepository().averageDuration(MetricFilter.all())).hasValueCloseTo(140.0 / 3, within(1e-9));
    }
}
