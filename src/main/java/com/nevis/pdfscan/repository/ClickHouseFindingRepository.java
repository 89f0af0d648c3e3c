package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.PageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
public class ClickHouseFindingRepository implements FindingRepository {

    private static final String COLUMNS = """
        id, document_id, finding_type, location, confidence,
        toUnixTimestamp64Milli(created_at) AS created_at_ms
        """;

    private static final String INSERT_SQL = """
        INSERT INTO findings (id, document_id, finding_type, location, confidence, created_at)
        VALUES (?, ?, ?, ?, ?, fromUnixTimestamp64Milli(?))
        """;

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Finding> findingRowMapper = (rs, rowNum) -> new Finding(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        FindingType.fromTag(rs.getString("finding_type")),
        rs.getString("location"),
        rs.getDouble("confidence"),
        OffsetDateTime.ofInstant(Instant.ofEpochMilli(rs.getLong("created_at_ms")), ZoneOffset.UTC)
    );

    @Override
    public Finding save(Finding finding) {
        saveAll(List.of(finding));
        return finding;
    }

    /**
     * One batch is one ClickHouse insert block, so a batch lands entirely or not at all.
     */
    @Override
    public void saveAll(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return;
        }

        jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                Finding finding = findings.get(i);
                ps.setObject(1, finding.id());
                ps.setObject(2, finding.documentId());
                ps.setString(3, finding.findingType().tag());
                ps.setString(4, finding.location());
                ps.setDouble(5, finding.confidence());
                ps.setLong(6, finding.createdAt().toInstant().toEpochMilli());
            }

            @Override
            public int getBatchSize() {
                return findings.size();
            }
        });
    }

    @Override
    public List<Finding> findByDocumentId(UUID documentId) {
        String sql = "SELECT " + COLUMNS + """
             FROM findings
            WHERE document_id = :documentId
            ORDER BY confidence DESC, toString(id) ASC
            """;

        return jdbcClient.sql(sql)
            .param("documentId", documentId)
            .query(findingRowMapper)
            .list();
    }

    @Override
    public List<Finding> findAll(Optional<FindingType> findingType, PageRequest page) {
        String sql = "SELECT " + COLUMNS + " FROM findings " +
            findingType.map(x -> "WHERE finding_type = :findingType ").orElse("") +
            """
            ORDER BY confidence DESC, toString(id) ASC
            LIMIT :limit OFFSET :offset
            """;

        var client = jdbcClient.sql(sql)
            .param("limit", page.limit())
            .param("offset", page.offset());

        findingType.ifPresent(type -> client.param("findingType", type.tag()));

        return client.query(findingRowMapper).list();
    }

    @Override
    public long count(Optional<FindingType> findingType) {
        String sql = "SELECT count() FROM findings" +
            findingType.map(x -> " WHERE finding_type = :findingType").orElse("");

        var client = jdbcClient.sql(sql);
        findingType.ifPresent(type -> client.param("findingType", type.tag()));

        return client.query(Long.class).single();
    }

    @Override
    public long countByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT count() FROM findings WHERE document_id = :documentId")
            .param("documentId", documentId)
            .query(Long.class)
            .single();
    }

    @Override
    public void deleteByDocumentId(UUID documentId) {
        jdbcClient.sql("DELETE FROM findings WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }
}
