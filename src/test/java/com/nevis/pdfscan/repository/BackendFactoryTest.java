package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.scanner.PatternRegistry;
import com.nevis.pdfscan.scanner.RegexDocumentScanner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BackendFactoryTest {

    @Test
    void inMemory_ShouldBuildIsolatedRepositories() {
        Backends first = BackendFactory.inMemory(new RegexDocumentScanner(PatternRegistry.defaults()));
        Backends second = BackendFactory.inMemory(new RegexDocumentScanner(PatternRegistry.defaults()));

        assertThat(first.document()).isInstanceOf(InMemoryDocumentRepository.class);
        assertThat(first.finding()).isInstanceOf(InMemoryFindingRepository.class);
        assertThat(first.metrics()).isInstanceOf(InMemoryMetricsRepository.class);
        assertThat(first.document()).isNotSameAs(second.document());
        assertThat(first.toString()).contains("InMemoryDocumentRepository", "RegexDocumentScanner");
    }
}
