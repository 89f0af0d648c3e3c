package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.PageRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(UUID id);
    void updateStatus(UUID id, DocumentStatus status, String errorMessage);
    List<Document> findAll(PageRequest page);
    long count();
}
