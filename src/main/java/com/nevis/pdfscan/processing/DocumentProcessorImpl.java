package com.nevis.pdfscan.processing;

import com.nevis.pdfscan.config.UploadProperties;
import com.nevis.pdfscan.exception.DocumentUnreadableException;
import com.nevis.pdfscan.exception.ScanException;
import com.nevis.pdfscan.exception.StorageException;
import com.nevis.pdfscan.extraction.TextExtractor;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingCandidate;
import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.ProcessingResult;
import com.nevis.pdfscan.repository.Backends;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentProcessorImpl implements DocumentProcessor {

    private final Backends backends;
    private final TextExtractor textExtractor;
    private final UploadProperties uploadProperties;
    private final Clock clock;

    @Override
    public ProcessingResult processUpload(byte[] content, String filename, long declaredSize) {
        Document document = Document.create(filename, declaredSize, clock);
        log.debug("Processing upload '{}' as document {}", filename, document.id());

        try {
            backends.document().save(document);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store document " + document.id(), e);
        }

        Document current = document;
        int findingsCount = 0;
        String failure = null;

        try (StagedUpload staged = stage(content, document)) {
            current = transition(current, DocumentStatus.PROCESSING, null);

            UUID documentId = document.id();
            List<Finding> findings = timedScan(document, staged).stream()
                .map(candidate -> Finding.from(candidate, documentId, clock))
                .toList();

            backends.finding().saveAll(findings);
            current = transition(current, DocumentStatus.COMPLETED, null);
            findingsCount = findings.size();
        } catch (ScanException e) {
            failure = e.getMessage();
        } catch (DataAccessException e) {
            log.error("Doc {}: storage failure during processing", document.id(), e);
            discardFindings(document.id());
            failure = "Storage failure: " + e.getMostSpecificCause().getMessage();
        }

        if (failure != null) {
            current = markFailed(current, failure);
            log.info("Doc {}: scan failed: {}", document.id(), failure);
        } else {
            log.info("Doc {}: scan completed with {} findings", document.id(), findingsCount);
        }

        return ProcessingResult.of(current, findingsCount);
    }

    private StagedUpload stage(byte[] content, Document document) {
        StopWatch watch = new StopWatch();
        watch.start();
        try {
            return StagedUpload.stage(content, document.id(), uploadProperties.tempDir());
        } catch (IOException e) {
            // the scan never ran; report it as failed
            recordMetric(Metric.SCAN, 0.0, document.id(), scanMetadata(null));
            throw new ScanException("Failed to stage upload: " + e.getMessage(), e);
        } finally {
            watch.stop();
            recordMetric(Metric.UPLOAD, elapsedMs(watch), document.id(), Map.of(
                "file_size", document.fileSize(),
                "filename", document.filename()
            ));
        }
    }

    private List<FindingCandidate> timedScan(Document document, StagedUpload staged) {
        StopWatch watch = new StopWatch();
        watch.start();
        List<FindingCandidate> candidates = null;
        try {
            candidates = extractAndScan(staged);
            return candidates;
        } finally {
            watch.stop();
            recordMetric(Metric.SCAN, elapsedMs(watch), document.id(), scanMetadata(candidates));
        }
    }

    private Map<String, Object> scanMetadata(List<FindingCandidate> candidates) {
        return Map.of(
            "findings_count", candidates == null ? 0 : candidates.size(),
            "scanner_type", backends.scanner().getClass().getSimpleName(),
            "outcome", candidates == null ? DocumentStatus.FAILED.tag() : DocumentStatus.COMPLETED.tag()
        );
    }

    private List<FindingCandidate> extractAndScan(StagedUpload staged) {
        List<String> pages;
        try {
            pages = textExtractor.extractPages(staged.read());
        } catch (DocumentUnreadableException e) {
            throw new ScanException(e.getMessage(), e);
        } catch (IOException e) {
            throw new ScanException("Failed to read staged upload: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ScanException("Text extraction failed: " + e.getMessage(), e);
        }

        try {
            return backends.scanner().scan(pages);
        } catch (RuntimeException e) {
            throw new ScanException("Scan failed: " + e.getMessage(), e);
        }
    }

    private Document transition(Document current, DocumentStatus next, String errorMessage) {
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalStateException(
                "Document %s cannot move from %s to %s".formatted(current.id(), current.status(), next));
        }
        backends.document().updateStatus(current.id(), next, errorMessage);
        return current.withStatus(next, errorMessage);
    }

    /**
     * Settles the document as failed. The returned record reports the failure even when the
     * status write itself is lost; the stored row then stays in its previous status.
     */
    private Document markFailed(Document current, String message) {
        String errorMessage = message == null || message.isBlank() ? "Processing failed" : message;
        try {
            return transition(current, DocumentStatus.FAILED, errorMessage);
        } catch (DataAccessException e) {
            log.error("Doc {}: could not record failed status", current.id(), e);
            return current.withStatus(DocumentStatus.FAILED, errorMessage);
        }
    }

    private void discardFindings(UUID documentId) {
        try {
            backends.finding().deleteByDocumentId(documentId);
        } catch (DataAccessException e) {
            log.error("Doc {}: could not discard findings of failed scan", documentId, e);
        }
    }

    private static double elapsedMs(StopWatch watch) {
        return watch.getTotalTimeNanos() / 1_000_000.0;
    }

    private void recordMetric(String operation, double durationMs, UUID documentId, Map<String, Object> metadata) {
        try {
            backends.metrics().save(Metric.create(operation, durationMs, documentId, metadata, clock));
        } catch (RuntimeException e) {
            log.warn("Doc {}: failed to record {} metric: {}", documentId, operation, e.getMessage());
        }
    }
}
