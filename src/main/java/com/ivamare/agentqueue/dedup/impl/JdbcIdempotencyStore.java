package com.ivamare.agentqueue.dedup.impl;

import com.ivamare.agentqueue.dedup.IdempotencyStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * PostgreSQL idempotency store. The primary key on {@code (org_id, dedup_key)}
 * makes the insert the atomic check-and-mark.
 */
public class JdbcIdempotencyStore implements IdempotencyStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcIdempotencyStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean markIfAbsent(String orgId, String dedupKey) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO agentqueue.idempotency_keys (org_id, dedup_key) VALUES (?, ?) "
                + "ON CONFLICT (org_id, dedup_key) DO NOTHING",
            orgId, dedupKey
        );
        return inserted == 1;
    }

    @Override
    public void release(String orgId, String dedupKey) {
        jdbcTemplate.update(
            "DELETE FROM agentqueue.idempotency_keys WHERE org_id = ? AND dedup_key = ?",
            orgId, dedupKey
        );
    }

    @Override
    public boolean contains(String orgId, String dedupKey) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM agentqueue.idempotency_keys WHERE org_id = ? AND dedup_key = ?)",
            Boolean.class,
            orgId, dedupKey
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        return jdbcTemplate.update(
            "DELETE FROM agentqueue.idempotency_keys WHERE created_at < ?",
            Timestamp.from(cutoff)
        );
    }
}
