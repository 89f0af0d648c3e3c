package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.service.MetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.OptionalDouble;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsService metricsService;

    @GetMapping("/metrics")
    public ResponseEntity<PageResponse<Metric>> getMetrics(
        @RequestParam(required = false) String operation,
        @RequestParam(name = "document_id", required = false) UUID documentId,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end,
        @RequestParam(defaultValue = "100") int limit,
        @RequestParam(defaultValue = "0") int offset) {

        MetricFilter filter = new MetricFilter(operation, documentId, start, end);
        return ResponseEntity.ok(PageResponse.from(metricsService.getMetrics(filter, PageRequest.of(limit, offset))));
    }

    @GetMapping("/metrics/average")
    public ResponseEntity<AverageDurationResponse> getAverageDuration(
        @RequestParam(required = false) String operation,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end) {

        OptionalDouble average = metricsService.averageDuration(new MetricFilter(operation, null, start, end));
        return ResponseEntity.ok(new AverageDurationResponse(
            operation,
            average.isPresent() ? average.getAsDouble() : null
        ));
    }
}
