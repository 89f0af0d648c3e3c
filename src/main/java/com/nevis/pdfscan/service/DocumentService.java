package com.nevis.pdfscan.service;

import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.Page;
import com.nevis.pdfscan.model.PageRequest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentService {
    Document getDocument(UUID id);
    Page<Document> listDocuments(PageRequest page);
    List<Finding> getFindingsForDocument(UUID documentId);
    Page<Finding> listFindings(Optional<FindingType> findingType, PageRequest page);
}
