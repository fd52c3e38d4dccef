package com.proxylens.storage.jdbc;

import com.proxylens.domain.Event;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.StorageException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Event store backed by the events table. Batches are written in one transaction.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "jdbc")
public class JdbcEventStore implements EventStore {

    private static final String COLUMNS = "id, upload_id, ts, event_id, vendor, dialect, action, reason, severity, "
        + "http_status, user_email, department, location, client_ip, server_ip, dest_host, url, request_method, "
        + "url_category, threat_category, threat_name, risk_score, request_size, response_size, transaction_size, raw";

    private static final String INSERT_SQL = "insert into events (" + COLUMNS + ") values "
        + "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final RowMapper<Event> ROW_MAPPER = new EventRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcEventStore(JdbcTemplate proxylensJdbcTemplate, TransactionTemplate proxylensTransactionTemplate) {
        this.jdbcTemplate = proxylensJdbcTemplate;
        this.transactionTemplate = proxylensTransactionTemplate;
    }

    @Override
    public void appendAll(List<Event> events) {
        if (events.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(events.size());
        for (Event e : events) {
            rows.add(new Object[]{
                e.getId(),
                e.getUploadId(),
                JdbcSupport.toTimestamp(e.getTimestamp().orElse(null)),
                e.getVendorEventId().orElse(null),
                e.getVendor().orElse(null),
                e.getDialect().orElse(null),
                e.getAction().orElse(null),
                e.getReason().orElse(null),
                e.getSeverity().orElse(null),
                e.getHttpStatus().orElse(null),
                e.getUserEmail().orElse(null),
                e.getDepartment().orElse(null),
                e.getLocation().orElse(null),
                e.getClientIp().orElse(null),
                e.getServerIp().orElse(null),
                e.getDestHost().orElse(null),
                e.getUrl().orElse(null),
                e.getRequestMethod().orElse(null),
                e.getUrlCategory().orElse(null),
                e.getThreatCategory().orElse(null),
                e.getThreatName().orElse(null),
                e.getRiskScore().orElse(null),
                e.getRequestSize().orElse(null),
                e.getResponseSize().orElse(null),
                e.getTransactionSize().orElse(null),
                e.getRaw()
            });
        }
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(INSERT_SQL, rows));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append " + events.size() + " events", "events", e);
        }
    }

    @Override
    public List<Event> findByUpload(String uploadId) {
        try {
            return jdbcTemplate.query(
                "select " + COLUMNS + " from events where upload_id = ? order by seq", ROW_MAPPER, uploadId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read events of upload " + uploadId, "events", e);
        }
    }

    @Override
    public List<Event> findByIds(String uploadId, Collection<String> eventIds) {
        if (eventIds.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        args.add(uploadId);
        args.addAll(eventIds);
        try {
            return jdbcTemplate.query(
                "select " + COLUMNS + " from events where upload_id = ? and id in ("
                    + JdbcSupport.placeholders(eventIds) + ") order by seq",
                ROW_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read events of upload " + uploadId, "events", e);
        }
    }

    @Override
    public long countByUpload(String uploadId) {
        try {
            Long count = jdbcTemplate.queryForObject(
                "select count(*) from events where upload_id = ?", Long.class, uploadId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count events of upload " + uploadId, "events", e);
        }
    }

    @Override
    public long deleteByUpload(String uploadId) {
        try {
            return jdbcTemplate.update("delete from events where upload_id = ?", uploadId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete events of upload " + uploadId, "events", e);
        }
    }

    /**
     * Row mapper for events
     */
    private static class EventRowMapper implements RowMapper<Event> {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Event.builder()
                .id(rs.getString("id"))
                .uploadId(rs.getString("upload_id"))
                .timestamp(JdbcSupport.getInstant(rs, "ts"))
                .vendorEventId(rs.getString("event_id"))
                .vendor(rs.getString("vendor"))
                .dialect(rs.getString("dialect"))
                .action(rs.getString("action"))
                .reason(rs.getString("reason"))
                .severity(rs.getString("severity"))
                .httpStatus(rs.getString("http_status"))
                .userEmail(rs.getString("user_email"))
                .department(rs.getString("department"))
                .location(rs.getString("location"))
                .clientIp(rs.getString("client_ip"))
                .serverIp(rs.getString("server_ip"))
                .destHost(rs.getString("dest_host"))
                .url(rs.getString("url"))
                .requestMethod(rs.getString("request_method"))
                .urlCategory(rs.getString("url_category"))
                .threatCategory(rs.getString("threat_category"))
                .threatName(rs.getString("threat_name"))
                .riskScore(JdbcSupport.getInteger(rs, "risk_score"))
                .requestSize(JdbcSupport.getLong(rs, "request_size"))
                .responseSize(JdbcSupport.getLong(rs, "response_size"))
                .transactionSize(JdbcSupport.getLong(rs, "transaction_size"))
                .raw(rs.getString("raw"))
                .build();
        }
    }
}
