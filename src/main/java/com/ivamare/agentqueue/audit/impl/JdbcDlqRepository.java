package com.ivamare.agentqueue.audit.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.audit.DlqQuery;
import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.util.Jsons;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of DlqRepository.
 */
public class JdbcDlqRepository implements DlqRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DlqMessage> dlqMapper;

    public JdbcDlqRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.dlqMapper = (rs, rowNum) -> {
            Map<String, Object> error = Jsons.readMap(this.objectMapper, rs.getString("error"));
            return new DlqMessage(
                rs.getLong("id"),
                rs.getString("org_id"),
                rs.getString("message_id"),
                rs.getString("type"),
                Jsons.readMap(this.objectMapper, rs.getString("original_message")),
                new DlqMessage.Failure(
                    error != null ? (String) error.get("type") : null,
                    error != null ? (String) error.get("message") : null
                ),
                rs.getBoolean("can_replay"),
                rs.getTimestamp("dlq_timestamp").toInstant()
            );
        };
    }

    @Override
    public List<DlqMessage> findReplayable(DlqQuery query) {
        StringBuilder sql = new StringBuilder(
            "SELECT * FROM agentqueue.dlq_messages WHERE org_id = ? AND can_replay = TRUE");
        List<Object> params = new ArrayList<>();
        params.add(query.orgId());

        if (query.type() != null) {
            sql.append(" AND type = ?");
            params.add(query.type());
        }
        if (query.since() != null) {
            sql.append(" AND dlq_timestamp >= ?");
            params.add(Timestamp.from(query.since()));
        }
        if (query.until() != null) {
            sql.append(" AND dlq_timestamp < ?");
            params.add(Timestamp.from(query.until()));
        }
        sql.append(" ORDER BY dlq_timestamp ASC, id ASC LIMIT ?");
        params.add(query.limit());

        return jdbcTemplate.query(sql.toString(), dlqMapper, params.toArray());
    }

    @Override
    public int markReplayed(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Object[]> batchArgs = ids.stream()
            .map(id -> new Object[]{id})
            .toList();
        int[] counts = jdbcTemplate.batchUpdate(
            "UPDATE agentqueue.dlq_messages SET can_replay = FALSE, replayed_at = NOW() WHERE id = ?",
            batchArgs
        );
        int total = 0;
        for (int count : counts) {
            total += Math.max(count, 0);
        }
        return total;
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        return jdbcTemplate.update(
            "DELETE FROM agentqueue.dlq_messages WHERE dlq_timestamp < ?",
            Timestamp.from(cutoff)
        );
    }
}
