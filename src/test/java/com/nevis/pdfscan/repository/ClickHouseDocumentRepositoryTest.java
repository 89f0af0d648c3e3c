package com.nevis.pdfscan.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClickHouseDocumentRepositoryTest extends BaseClickHouseTest implements DocumentRepositoryContract {

    @Override
    public DocumentRepository documentRepository() {
        return backends.document();
    }

    @Test
    @DisplayName("Should wire the ClickHouse repositories when the backend is selected")
    void backends_ShouldUseClickHouse() {
        assertThat(backends.document()).isInstanceOf(ClickHouseDocumentRepository.class);
        assertThat(backends.finding()).isInstanceOf(ClickHouseFindingRepository.class);
        assertThat(backends.metrics()).isInstanceOf(ClickHouseMetricsRepository.class);
    }
}
