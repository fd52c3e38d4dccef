package com.proxylens.storage.jdbc;

import com.proxylens.domain.RollupBucket;
import com.proxylens.domain.RollupKey;
import com.proxylens.storage.RollupRepository;
import com.proxylens.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rollup store backed by event_rollup_minute.
 *
 * A replace upserts every bucket by primary key and then deletes the upload's keys
 * that were not part of the new set, inside one transaction. Running it twice over
 * the same buckets leaves identical rows.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "jdbc")
public class JdbcRollupRepository implements RollupRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRollupRepository.class);

    private static final String UPSERT_SQL = """
        insert into event_rollup_minute
            (upload_id, bucket, user_email, client_ip, dest_host, action, threat_category, total)
        values (?, ?, ?, ?, ?, ?, ?, ?)
        on conflict (upload_id, bucket, user_email, client_ip, dest_host, action, threat_category)
        do update set total = excluded.total
        """;

    private static final String DELETE_KEY_SQL = """
        delete from event_rollup_minute
        where upload_id = ? and bucket = ? and user_email = ? and client_ip = ?
          and dest_host = ? and action = ? and threat_category = ?
        """;

    private static final String SELECT_SQL = """
        select upload_id, bucket, user_email, client_ip, dest_host, action, threat_category, total
        from event_rollup_minute
        where upload_id = ?
        order by bucket, user_email, client_ip, dest_host, action, threat_category
        """;

    private static final RowMapper<RollupBucket> ROW_MAPPER = (rs, rowNum) -> new RollupBucket(
        new RollupKey(
            rs.getString("upload_id"),
            JdbcSupport.getInstant(rs, "bucket"),
            rs.getString("user_email"),
            rs.getString("client_ip"),
            rs.getString("dest_host"),
            rs.getString("action"),
            rs.getString("threat_category")),
        rs.getLong("total"));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcRollupRepository(JdbcTemplate proxylensJdbcTemplate, TransactionTemplate proxylensTransactionTemplate) {
        this.jdbcTemplate = proxylensJdbcTemplate;
        this.transactionTemplate = proxylensTransactionTemplate;
    }

    @Override
    public void replaceAll(String uploadId, Collection<RollupBucket> buckets) {
        Set<RollupKey> fresh = new HashSet<>();
        List<Object[]> upserts = new ArrayList<>(buckets.size());
        for (RollupBucket bucket : buckets) {
            RollupKey key = bucket.getKey();
            fresh.add(key);
            upserts.add(keyArgs(key, bucket.getTotal()));
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!upserts.isEmpty()) {
                    jdbcTemplate.batchUpdate(UPSERT_SQL, upserts);
                }
                List<Object[]> stale = new ArrayList<>();
                for (RollupBucket existing : jdbcTemplate.query(SELECT_SQL, ROW_MAPPER, uploadId)) {
                    if (!fresh.contains(existing.getKey())) {
                        stale.add(keyArgs(existing.getKey(), null));
                    }
                }
                if (!stale.isEmpty()) {
                    jdbcTemplate.batchUpdate(DELETE_KEY_SQL, stale);
                }
                log.debug("Upserted {} rollup buckets, removed {} stale for upload {}",
                    upserts.size(), stale.size(), uploadId);
            });
        } catch (DataAccessException e) {
            throw new StorageException("Failed to replace rollups of upload " + uploadId, "event_rollup_minute", e);
        }
    }

    @Override
    public List<RollupBucket> findByUpload(String uploadId) {
        try {
            return jdbcTemplate.query(SELECT_SQL, ROW_MAPPER, uploadId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read rollups of upload " + uploadId, "event_rollup_minute", e);
        }
    }

    @Override
    public long deleteByUpload(String uploadId) {
        try {
            return jdbcTemplate.update("delete from event_rollup_minute where upload_id = ?", uploadId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete rollups of upload " + uploadId, "event_rollup_minute", e);
        }
    }

    private static Object[] keyArgs(RollupKey key, Long total) {
        Object[] base = {
            key.getUploadId(),
            JdbcSupport.toTimestamp(key.getBucket()),
            key.getUserEmail(),
            key.getClientIp(),
            key.getDestHost(),
            key.getAction(),
            key.getThreatCategory()
        };
        if (total == null) {
            return base;
        }
        Object[] withTotal = new Object[base.length + 1];
        System.arraycopy(base, 0, withTotal, 0, base.length);
        withTotal[base.length] = total;
        return withTotal;
    }
}
