package com.nevis.pdfscan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.repository.BackendFactory;
import com.nevis.pdfscan.repository.Backends;
import com.nevis.pdfscan.scanner.DocumentScanner;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Builds the single {@link Backends} bundle for the process. The ClickHouse connection pool
 * only exists when {@code app.storage.backend=clickhouse}, and Spring closes it on shutdown.
 */
@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    public Backends backends(
        StorageProperties storage,
        DocumentScanner scanner,
        ObjectProvider<JdbcTemplate> clickHouseJdbcTemplate,
        ObjectMapper objectMapper
    ) {
        Backends backends = switch (storage.backend()) {
            case MEMORY -> BackendFactory.inMemory(scanner);
            case CLICKHOUSE -> BackendFactory.clickHouse(clickHouseJdbcTemplate.getObject(), objectMapper, scanner);
        };
        log.info("Using {} storage: {}", storage.backend(), backends);
        return backends;
    }

    @Configuration
    @ConditionalOnProperty(name = "app.storage.backend", havingValue = "clickhouse")
    static class ClickHouseDataSourceConfig {

        @Bean(destroyMethod = "close")
        public HikariDataSource clickHouseDataSource(ClickHouseProperties properties) {
            HikariConfig config = new HikariConfig();
            config.setPoolName("clickhouse");
            config.setJdbcUrl(properties.url());
            config.setUsername(properties.username());
            config.setPassword(properties.password());
            config.setMaximumPoolSize(properties.maxPoolSize());
            config.setConnectionTimeout(properties.queryTimeout().toMillis());
            return new HikariDataSource(config);
        }

        @Bean
        public JdbcTemplate clickHouseJdbcTemplate(DataSource clickHouseDataSource, ClickHouseProperties properties) {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(clickHouseDataSource);
            jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.queryTimeout().toSeconds()));
            return jdbcTemplate;
        }

        @Bean
        @ConditionalOnProperty(name = "app.clickhouse.init-schema", havingValue = "true", matchIfMissing = true)
        public DataSourceInitializer clickHouseSchemaInitializer(DataSource clickHouseDataSource) {
            DataSourceInitializer initializer = new DataSourceInitializer();
            initializer.setDataSource(clickHouseDataSource);
            initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema/clickhouse.sql")));
            return initializer;
        }
    }
}
