package com.proxylens.storage.jdbc;

import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.storage.IngestJobRepository;
import com.proxylens.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Ingest job store backed by the ingest_jobs table.
 *
 * Transitions and counter increments are single conditional UPDATE statements,
 * so concurrent writers cannot lose updates.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "jdbc")
public class JdbcIngestJobRepository implements IngestJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcIngestJobRepository.class);

    private static final String COLUMNS =
        "id, upload_id, status, inserted_events, bad_lines, error, created_at, updated_at";

    private static final RowMapper<IngestJob> ROW_MAPPER = new IngestJobRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcIngestJobRepository(JdbcTemplate proxylensJdbcTemplate) {
        this.jdbcTemplate = proxylensJdbcTemplate;
    }

    @Override
    public IngestJob insert(IngestJob job) {
        try {
            jdbcTemplate.update(
                "insert into ingest_jobs (" + COLUMNS + ") values (?, ?, ?, ?, ?, ?, ?, ?)",
                job.getId(),
                job.getUploadId(),
                job.getStatus().getValue(),
                job.getInsertedEvents(),
                job.getBadLines(),
                job.getError(),
                JdbcSupport.toTimestamp(job.getCreatedAt()),
                JdbcSupport.toTimestamp(job.getUpdatedAt()));
            return job;
        } catch (DataAccessException e) {
            log.error("Failed to insert ingest job: {}", job.getId(), e);
            throw new StorageException("Failed to insert ingest job", "ingest_jobs", e);
        }
    }

    @Override
    public Optional<IngestJob> findById(String jobId) {
        try {
            List<IngestJob> jobs = jdbcTemplate.query(
                "select " + COLUMNS + " from ingest_jobs where id = ?", ROW_MAPPER, jobId);
            return jobs.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read ingest job " + jobId, "ingest_jobs", e);
        }
    }

    @Override
    public Optional<IngestJob> findLatestByUpload(String uploadId) {
        try {
            List<IngestJob> jobs = jdbcTemplate.query(
                "select " + COLUMNS + " from ingest_jobs where upload_id = ? order by created_at desc, id desc limit 1",
                ROW_MAPPER, uploadId);
            return jobs.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read ingest jobs of upload " + uploadId, "ingest_jobs", e);
        }
    }

    @Override
    public boolean hasActiveJob(String uploadId) {
        try {
            Integer active = jdbcTemplate.queryForObject(
                "select count(*) from ingest_jobs where upload_id = ? and status in ('queued', 'running')",
                Integer.class, uploadId);
            return active != null && active > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to check active jobs of upload " + uploadId, "ingest_jobs", e);
        }
    }

    @Override
    public IngestJob transition(String jobId, IngestJobStatus next, String error) {
        List<String> allowedFrom = new ArrayList<>();
        for (IngestJobStatus status : IngestJobStatus.values()) {
            if (status.canTransitionTo(next)) {
                allowedFrom.add(status.getValue());
            }
        }
        if (allowedFrom.isEmpty()) {
            throw new IllegalStateException("No status can move to " + next.getValue());
        }

        List<Object> args = new ArrayList<>();
        args.add(next.getValue());
        args.add(next == IngestJobStatus.FAILED ? error : null);
        args.add(JdbcSupport.toTimestamp(Instant.now()));
        args.add(jobId);
        args.addAll(allowedFrom);

        int updated;
        try {
            updated = jdbcTemplate.update(
                "update ingest_jobs set status = ?, error = ?, updated_at = ? where id = ? and status in ("
                    + JdbcSupport.placeholders(allowedFrom) + ")",
                args.toArray());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to update ingest job " + jobId, "ingest_jobs", e);
        }

        IngestJob job = findById(jobId).orElseThrow(() -> new NoSuchElementException("Unknown job: " + jobId));
        if (updated == 0) {
            throw new IllegalStateException(
                "Job " + jobId + " cannot move from " + job.getStatus().getValue() + " to " + next.getValue());
        }
        return job;
    }

    @Override
    public IngestJob addProgress(String jobId, long insertedEvents, long badLines) {
        int updated;
        try {
            updated = jdbcTemplate.update(
                "update ingest_jobs set inserted_events = inserted_events + ?, bad_lines = bad_lines + ?, "
                    + "updated_at = ? where id = ? and status = 'running'",
                insertedEvents, badLines, JdbcSupport.toTimestamp(Instant.now()), jobId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to update counters of ingest job " + jobId, "ingest_jobs", e);
        }

        IngestJob job = findById(jobId).orElseThrow(() -> new NoSuchElementException("Unknown job: " + jobId));
        if (updated == 0) {
            throw new IllegalStateException("Job " + jobId + " is not running: " + job.getStatus().getValue());
        }
        return job;
    }

    /**
     * Row mapper for ingest jobs
     */
    private static class IngestJobRowMapper implements RowMapper<IngestJob> {
        @Override
        public IngestJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            return IngestJob.builder()
                .id(rs.getString("id"))
                .uploadId(rs.getString("upload_id"))
                .status(IngestJobStatus.fromValue(rs.getString("status")))
                .insertedEvents(rs.getLong("inserted_events"))
                .badLines(rs.getLong("bad_lines"))
                .error(rs.getString("error"))
                .createdAt(JdbcSupport.getInstant(rs, "created_at"))
                .updatedAt(JdbcSupport.getInstant(rs, "updated_at"))
                .build();
        }
    }
}
