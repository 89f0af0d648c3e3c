package com.nevis.pdfscan.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricFilter;
import com.nevis.pdfscan.model.PageRequest;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Metrics are append-only. The table TTL drops rows 90 days after their timestamp.
 */
@RequiredArgsConstructor
public class ClickHouseMetricsRepository implements MetricsRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = """
        id, operation, duration_ms, toUnixTimestamp64Milli(timestamp) AS timestamp_ms,
        document_id, metadata
        """;

    private record Where(String sql, Map<String, Object> params) {}

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<Metric> metricRowMapper = (rs, rowNum) -> new Metric(
        rs.getObject("id", UUID.class),
        rs.getString("operation"),
        rs.getDouble("duration_ms"),
        OffsetDateTime.ofInstant(Instant.ofEpochMilli(rs.getLong("timestamp_ms")), ZoneOffset.UTC),
        rs.getString("document_id") == null ? null : UUID.fromString(rs.getString("document_id")),
        readMetadata(rs.getString("metadata"))
    );

    @Override
    public Metric save(Metric metric) {
        jdbcClient.sql("""
                INSERT INTO metrics (id, operation, duration_ms, timestamp, document_id, metadata)
                VALUES (:id, :operation, :durationMs, fromUnixTimestamp64Milli(:timestampMs), :documentId, :metadata)
                """)
            .param("id", metric.id())
            .param("operation", metric.operation())
            .param("durationMs", metric.durationMs())
            .param("timestampMs", metric.timestamp().toInstant().toEpochMilli())
            .param("documentId", metric.documentId() == null ? null : metric.documentId().toString(), Types.VARCHAR)
            .param("metadata", writeMetadata(metric.metadata()))
            .update();
        return metric;
    }

    @Override
    public List<Metric> find(MetricFilter filter, PageRequest page) {
        Where where = where(filter, true);

        String sql = "SELECT " + COLUMNS + " FROM metrics" + where.sql() + """

            ORDER BY timestamp DESC, toString(id) ASC
            LIMIT :limit OFFSET :offset
            """;

        return jdbcClient.sql(sql)
            .params(where.params())
            .param("limit", page.limit())
            .param("offset", page.offset())
            .query(metricRowMapper)
            .list();
    }

    @Override
    public long count(MetricFilter filter) {
        Where where = where(filter, true);

        return jdbcClient.sql("SELECT count() FROM metrics" + where.sql())
            .params(where.params())
            .query(Long.class)
            .single();
    }

    @Override
    public OptionalDouble averageDuration(MetricFilter filter) {
        Where where = where(filter, false);

        String sql = "SELECT count() AS cnt, avg(duration_ms) AS avg_duration FROM metrics" + where.sql();

        return jdbcClient.sql(sql)
            .params(where.params())
            .query((rs, rowNum) -> rs.getLong("cnt") == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of(rs.getDouble("avg_duration")))
            .single();
    }

    private Where where(MetricFilter filter, boolean includeDocument) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (filter.operation() != null) {
            clauses.add("operation = :operation");
            params.put("operation", filter.operation());
        }
        if (includeDocument && filter.documentId() != null) {
            clauses.add("document_id = toUUID(:documentId)");
            params.put("documentId", filter.documentId().toString());
        }
        if (filter.start() != null) {
            clauses.add("timestamp >= fromUnixTimestamp64Milli(:startMs)");
            params.put("startMs", filter.start().toInstant().toEpochMilli());
        }
        if (filter.end() != null) {
            clauses.add("timestamp <= fromUnixTimestamp64Milli(:endMs)");
            params.put("endMs", filter.end().toInstant().toEpochMilli());
        }

        String sql = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return new Where(sql, params);
    }

    @SneakyThrows
    private String writeMetadata(Map<String, Object> metadata) {
        return objectMapper.writeValueAsString(metadata);
    }

    @SneakyThrows
    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, METADATA_TYPE);
    }
}
