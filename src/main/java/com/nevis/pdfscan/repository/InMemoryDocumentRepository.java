package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.exception.EntityNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.PageRequest;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local document store. Everything is lost when the process stops.
 */
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<UUID, Document> documents = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Document save(Document document) {
        lock.writeLock().lock();
        try {
            documents.put(document.id(), document);
            return document;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Document> findById(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documents.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, String errorMessage) {
        lock.writeLock().lock();
        try {
            Document current = documents.get(id);
            if (current == null) {
                throw new EntityNotFoundException(id);
            }
            documents.put(id, current.withStatus(status, errorMessage));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Document> findAll(PageRequest page) {
        lock.readLock().lock();
        try {
            return documents.values().stream()
                .sorted(RepositoryOrdering.DOCUMENTS_NEWEST_FIRST)
                .skip(page.offset())
                .limit(page.limit())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
