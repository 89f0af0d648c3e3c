package com.nevis.pdfscan.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.clickhouse")
public record ClickHouseProperties(
    @NotBlank @DefaultValue("jdbc:clickhouse://localhost:8123/default") String url,
    @DefaultValue("default") String username,
    String password,
    @Min(1) @Max(100) @DefaultValue("10") int maxPoolSize,
    @NotNull @DefaultValue("10s") Duration queryTimeout,
    @DefaultValue("true") boolean initSchema
) {}
