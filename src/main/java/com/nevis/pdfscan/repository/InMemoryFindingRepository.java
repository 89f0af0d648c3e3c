package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.PageRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

public class InMemoryFindingRepository implements FindingRepository {

    private final Map<UUID, Finding> findings = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Finding save(Finding finding) {
        lock.writeLock().lock();
        try {
            findings.put(finding.id(), finding);
            return finding;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveAll(List<Finding> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            batch.forEach(f -> findings.put(f.id(), f));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Finding> findByDocumentId(UUID documentId) {
        lock.readLock().lock();
        try {
            return findings.values().stream()
                .filter(f -> f.documentId().equals(documentId))
                .sorted(RepositoryOrdering.FINDINGS_MOST_CONFIDENT_FIRST)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Finding> findAll(Optional<FindingType> findingType, PageRequest page) {
        lock.readLock().lock();
        try {
            return findings.values().stream()
                .filter(ofType(findingType))
                .sorted(RepositoryOrdering.FINDINGS_MOST_CONFIDENT_FIRST)
                .skip(page.offset())
                .limit(page.limit())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count(Optional<FindingType> findingType) {
        lock.readLock().lock();
        try {
            return findings.values().stream().filter(ofType(findingType)).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countByDocumentId(UUID documentId) {
        lock.readLock().lock();
        try {
            return findings.values().stream()
                .filter(f -> f.documentId().equals(documentId))
                .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteByDocumentId(UUID documentId) {
        lock.writeLock().lock();
        try {
            findings.values().removeIf(f -> f.documentId().equals(documentId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Predicate<Finding> ofType(Optional<FindingType> findingType) {
        return f -> findingType.map(t -> t == f.findingType()).orElse(true);
    }
}
