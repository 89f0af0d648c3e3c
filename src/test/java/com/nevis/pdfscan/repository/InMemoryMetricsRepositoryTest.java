package com.nevis.pdfscan.repository;

class InMemoryMetricsRepositoryTest implements MetricsRepositoryContract {

    private final MetricsRepository repository = new InMemoryMetricsRepository();

    @Override
    public MetricsRepository metricsRepository() {
        return repository;
    }
}
