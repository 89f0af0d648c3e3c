package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.exception.EntityNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.PageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Documents live in a ReplacingMergeTree keyed on (upload_time, id). A status change
 * appends a row with a higher version; every read goes through FINAL so only the latest
 * version of each document is visible.
 */
@RequiredArgsConstructor
public class ClickHouseDocumentRepository implements DocumentRepository {

    private static final String COLUMNS = """
        id, filename, toUnixTimestamp64Milli(upload_time) AS upload_time_ms,
        status, file_size, error_message
        """;

    private final JdbcClient jdbcClient;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getObject("id", UUID.class),
        rs.getString("filename"),
        OffsetDateTime.ofInstant(Instant.ofEpochMilli(rs.getLong("upload_time_ms")), ZoneOffset.UTC),
        DocumentStatus.fromTag(rs.getString("status")),
        rs.getLong("file_size"),
        rs.getString("error_message")
    );

    @Override
    public Document save(Document document) {
        insert(document, 1L);
        return document;
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT " + COLUMNS + " FROM documents FINAL WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, String errorMessage) {
        Document current = findById(id).orElseThrow(() -> new EntityNotFoundException(id));

        Long version = jdbcClient.sql("SELECT max(version) FROM documents WHERE id = :id")
            .param("id", id)
            .query(Long.class)
            .single();

        insert(current.withStatus(status, errorMessage), version + 1);
    }

    @Override
    public List<Document> findAll(PageRequest page) {
        String sql = "SELECT " + COLUMNS + """
             FROM documents FINAL
            ORDER BY upload_time DESC, toString(id) ASC
            LIMIT :limit OFFSET :offset
            """;

        return jdbcClient.sql(sql)
            .param("limit", page.limit())
            .param("offset", page.offset())
            .query(documentRowMapper)
            .list();
    }

    @Override
    public long count() {
        return jdbcClient.sql("SELECT count() FROM documents FINAL")
            .query(Long.class)
            .single();
    }

    private void insert(Document document, long version) {
        jdbcClient.sql("""
                INSERT INTO documents (id, filename, upload_time, status, file_size, error_message, version)
                VALUES (:id, :filename, fromUnixTimestamp64Milli(:uploadTimeMs), :status, :fileSize, :errorMessage, :version)
                """)
            .param("id", document.id())
            .param("filename", document.filename())
            .param("uploadTimeMs", document.uploadTime().toInstant().toEpochMilli())
            .param("status", document.status().tag())
            .param("fileSize", document.fileSize())
            .param("errorMessage", document.errorMessage(), Types.VARCHAR)
            .param("version", version)
            .update();
    }
}
