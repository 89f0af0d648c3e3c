package com.nevis.pdfscan.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.scanner.DocumentScanner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;

public final class BackendFactory {

    private BackendFactory() {
    }

    public static Backends inMemory(DocumentScanner scanner) {
        return new Backends(
            new InMemoryDocumentRepository(),
            new InMemoryFindingRepository(),
            new InMemoryMetricsRepository(),
            scanner
        );
    }

    public static Backends clickHouse(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, DocumentScanner scanner) {
        JdbcClient jdbcClient = JdbcClient.create(jdbcTemplate);
        return new Backends(
            new ClickHouseDocumentRepository(jdbcClient),
            new ClickHouseFindingRepository(jdbcClient, jdbcTemplate),
            new ClickHouseMetricsRepository(jdbcClient, objectMapper),
            scanner
        );
    }
}
