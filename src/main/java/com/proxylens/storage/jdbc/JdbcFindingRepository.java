package com.proxylens.storage.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;
import com.proxylens.storage.FindingRepository;
import com.proxylens.storage.StorageException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finding store backed by the findings table. Evidence is kept as JSON text.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "jdbc")
public class JdbcFindingRepository implements FindingRepository {

    private static final TypeReference<Map<String, Object>> EVIDENCE_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS =
        "id, upload_id, pattern_name, severity, confidence, title, summary, evidence, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Finding> rowMapper;

    public JdbcFindingRepository(JdbcTemplate proxylensJdbcTemplate,
                                 TransactionTemplate proxylensTransactionTemplate,
                                 ObjectMapper objectMapper) {
        this.jdbcTemplate = proxylensJdbcTemplate;
        this.transactionTemplate = proxylensTransactionTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> Finding.builder()
            .id(rs.getString("id"))
            .uploadId(rs.getString("upload_id"))
            .patternName(rs.getString("pattern_name"))
            .severity(Severity.fromValue(rs.getString("severity")))
            .confidence(rs.getDouble("confidence"))
            .title(rs.getString("title"))
            .summary(rs.getString("summary"))
            .evidence(readEvidence(rs.getString("evidence")))
            .createdAt(JdbcSupport.getInstant(rs, "created_at"))
            .build();
    }

    @Override
    public void appendAll(List<Finding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            rows.add(new Object[]{
                f.getId(),
                f.getUploadId(),
                f.getPatternName(),
                f.getSeverity().getValue(),
                f.getConfidence(),
                f.getTitle(),
                f.getSummary(),
                writeEvidence(f),
                JdbcSupport.toTimestamp(f.getCreatedAt())
            });
        }
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                "insert into findings (" + COLUMNS + ") values (?, ?, ?, ?, ?, ?, ?, ?, ?)", rows));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append " + findings.size() + " findings", "findings", e);
        }
    }

    @Override
    public List<Finding> findByUpload(String uploadId) {
        try {
            return jdbcTemplate.query(
                "select " + COLUMNS + " from findings where upload_id = ? order by seq", rowMapper, uploadId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read findings of upload " + uploadId, "findings", e);
        }
    }

    @Override
    public long countByUpload(String uploadId) {
        try {
            Long count = jdbcTemplate.queryForObject(
                "select count(*) from findings where upload_id = ?", Long.class, uploadId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count findings of upload " + uploadId, "findings", e);
        }
    }

    private String writeEvidence(Finding finding) {
        try {
            return objectMapper.writeValueAsString(finding.getEvidence());
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize evidence of finding " + finding.getId(), "findings", e);
        }
    }

    private Map<String, Object> readEvidence(String json) throws SQLException {
        try {
            return objectMapper.readValue(json, EVIDENCE_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt evidence JSON", e);
        }
    }
}
