package com.nevis.pdfscan.repository;

class ClickHouseFindingRepositoryTest extends BaseClickHouseTest implements FindingRepositoryContract {

    @Override
    public FindingRepository findingRepository() {
        return backends.finding();
    }
}
