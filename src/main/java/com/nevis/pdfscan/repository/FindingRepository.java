package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.PageRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FindingRepository {
    Finding save(Finding finding);
    void saveAll(List<Finding> findings);
    List<Finding> findByDocumentId(UUID documentId);
    List<Finding> findAll(Optional<FindingType> findingType, PageRequest page);
    long count(Optional<FindingType> findingType);
    long countByDocumentId(UUID documentId);
    void deleteByDocumentId(UUID documentId);
}
