package com.nevis.pdfscan.repository;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.clickhouse.ClickHouseContainer;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * One ClickHouse container for every subclass, started on first use and left running
 * for the JVM, so the cached Spring context keeps a valid connection pool.
 */
@SpringBootTest(properties = "app.storage.backend=clickhouse")
public abstract class BaseClickHouseTest {

    static final ClickHouseContainer clickhouse = new ClickHouseContainer("clickhouse/clickhouse-server:24.3");

    @Autowired
    protected Backends backends;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeAll
    static void requireDocker() {
        assumeTrue(DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        clickhouse.start();
        registry.add("app.clickhouse.url", clickhouse::getJdbcUrl);
        registry.add("app.clickhouse.username", clickhouse::getUsername);
        registry.add("app.clickhouse.password", clickhouse::getPassword);
    }

    @BeforeEach
    void truncateTables() {
        jdbcTemplate.execute("TRUNCATE TABLE IF EXISTS documents");
        jdbcTemplate.execute("TRUNCATE TABLE IF EXISTS findings");
        jdbcTemplate.execute("TRUNCATE TABLE IF EXISTS metrics");
    }
}
