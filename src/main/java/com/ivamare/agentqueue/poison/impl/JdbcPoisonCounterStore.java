package com.ivamare.agentqueue.poison.impl;

import com.ivamare.agentqueue.poison.PoisonCounterStore;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * PostgreSQL poison counters using an upsert that returns the new count.
 */
public class JdbcPoisonCounterStore implements PoisonCounterStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPoisonCounterStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public int increment(String orgId, String dedupKey) {
        Integer count = jdbcTemplate.queryForObject(
            """
            INSERT INTO agentqueue.poison_counters (org_id, dedup_key, count, updated_at)
            VALUES (?, ?, 1, NOW())
            ON CONFLICT (org_id, dedup_key)
            DO UPDATE SET count = agentqueue.poison_counters.count + 1, updated_at = NOW()
            RETURNING count
            """,
            Integer.class,
            orgId, dedupKey
        );
        return count != null ? count : 0;
    }

    @Override
    public void reset(String orgId, String dedupKey) {
        jdbcTemplate.update(
            "DELETE FROM agentqueue.poison_counters WHERE org_id = ? AND dedup_key = ?",
            orgId, dedupKey
        );
    }

    @Override
    public int count(String orgId, String dedupKey) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(count), 0) FROM agentqueue.poison_counters WHERE org_id = ? AND dedup_key = ?",
            Integer.class,
            orgId, dedupKey
        );
        return count != null ? count : 0;
    }
}
