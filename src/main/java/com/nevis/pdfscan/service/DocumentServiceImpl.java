package com.nevis.pdfscan.service;

import com.nevis.pdfscan.exception.EntityNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.Page;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.repository.Backends;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final Backends backends;

    @Override
    public Document getDocument(UUID id) {
        log.debug("Fetching document by ID: {}", id);

        return backends.document().findById(id)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new EntityNotFoundException(id);
            });
    }

    @Override
    public Page<Document> listDocuments(PageRequest page) {
        return Page.of(backends.document().findAll(page), page, backends.document().count());
    }

    @Override
    public List<Finding> getFindingsForDocument(UUID documentId) {
        getDocument(documentId);
        return backends.finding().findByDocumentId(documentId);
    }

    @Override
    public Page<Finding> listFindings(Optional<FindingType> findingType, PageRequest page) {
        List<Finding> findings = backends.finding().findAll(findingType, page);
        return Page.of(findings, page, backends.finding().count(findingType));
    }
}
