package com.nevis.pdfscan.config;

public enum StorageBackend {
    MEMORY,
    CLICKHOUSE
}
