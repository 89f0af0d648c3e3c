package com.nevis.pdfscan.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * @param maxFileSize upload size ceiling enforced before processing
 * @param tempDir     where uploads are staged while scanning; the system temp dir when unset
 */
@Validated
@ConfigurationProperties(prefix = "app.upload")
public record UploadProperties(
    @NotNull @DefaultValue("10MB") DataSize maxFileSize,
    Path tempDir
) {}
