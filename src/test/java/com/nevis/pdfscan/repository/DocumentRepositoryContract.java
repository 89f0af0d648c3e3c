package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.exception.EntityNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.PageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link DocumentRepository} backend has to share.
 */
interface DocumentRepositoryContract {

    OffsetDateTime T0 = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    DocumentRepository documentRepository();

    private static Document pending(String filename, OffsetDateTime uploadTime) {
        return new Document(UUID.randomUUID(), filename, uploadTime, DocumentStatus.PENDING, 1234, null);
    }

    @Test
    @DisplayName("Should read back a saved document unchanged")
    default void save_ShouldRoundTrip() {
        Document document = pending("report.pdf", T0.plusNanos(123_000_000));

        documentRepository().save(document);

        assertThat(documentRepository().findById(document.id())).contains(document);
    }

    @Test
    @DisplayName("Should return empty for an unknown id")
    default void findById_ShouldBeEmpty_WhenMissing() {
        assertThat(documentRepository().findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("Should apply the latest status and error message")
    default void updateStatus_ShouldReplaceStatus() {
        Document document = documentRepository().save(pending("report.pdf", T0));

        documentRepository().updateStatus(document.id(), DocumentStatus.PROCESSING, null);
        documentRepository().updateStatus(document.id(), DocumentStatus.FAILED, "PDF is password-protected and cannot be scanned");

        Document stored = documentRepository().findById(document.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(DocumentStatus.FAILED);
        assertThat(stored.errorMessage()).isEqualTo("PDF is password-protected and cannot be scanned");
        assertThat(stored.uploadTime()).isEqualTo(document.uploadTime());
        assertThat(documentRepository().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject status updates for unknown documents")
    default void updateStatus_ShouldThrow_WhenMissing() {
        assertThatThrownBy(() -> documentRepository().updateStatus(UUID.randomUUID(), DocumentStatus.PROCESSING, null))
            .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("Should list newest uploads first and honour limit and offset")
    default void findAll_ShouldOrderNewestFirst() {
        Document oldest = documentRepository().save(pending("oldest.pdf", T0));
        Document middle = documentRepository().save(pending("middle.pdf", T0.plusMinutes(1)));
        Document newest = documentRepository().save(pending("newest.pdf", T0.plusMinutes(2)));

        assertThat(documentRepository().findAll(PageRequest.of(10, 0)))
            .extracting(Document::id)
            .containsExactly(newest.id(), middle.id(), oldest.id());

        List<Document> secondPage = documentRepository().findAll(PageRequest.of(2, 2));
        assertThat(secondPage).extracting(Document::id).containsExactly(oldest.id());
        assertThat(documentRepository().count()).isEqualTo(3);
    }
}
