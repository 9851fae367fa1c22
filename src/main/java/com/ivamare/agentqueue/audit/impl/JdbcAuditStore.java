package com.ivamare.agentqueue.audit.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.audit.AuditRepository;
import com.ivamare.agentqueue.audit.AuditSink;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageEventType;
import com.ivamare.agentqueue.model.MessageRecord;
import com.ivamare.agentqueue.model.MessageStatus;
import com.ivamare.agentqueue.util.Jsons;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of the audit sink and its query side.
 */
public class JdbcAuditStore implements AuditSink, AuditRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MessageEvent> eventMapper;
    private final RowMapper<MessageRecord> recordMapper;

    public JdbcAuditStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.eventMapper = (rs, rowNum) -> new MessageEvent(
            rs.getLong("id"),
            rs.getString("message_id"),
            rs.getString("org_id"),
            MessageEventType.fromValue(rs.getString("event_type")),
            Jsons.readMap(this.objectMapper, rs.getString("details")),
            rs.getTimestamp("created_at").toInstant()
        );
        this.recordMapper = (rs, rowNum) -> new MessageRecord(
            rs.getString("message_id"),
            rs.getString("org_id"),
            rs.getString("agent_id"),
            rs.getString("type"),
            rs.getInt("priority"),
            MessageStatus.fromValue(rs.getString("status")),
            Jsons.readMap(this.objectMapper, rs.getString("payload")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    @Override
    public void upsertMessage(MessageRecord record) {
        jdbcTemplate.update(
            """
            INSERT INTO agentqueue.messages
                (message_id, org_id, agent_id, type, priority, status, payload, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (org_id, message_id) DO UPDATE SET
                agent_id = EXCLUDED.agent_id,
                priority = EXCLUDED.priority,
                status = EXCLUDED.status,
                payload = EXCLUDED.payload,
                updated_at = EXCLUDED.updated_at
            """,
            record.messageId(),
            record.orgId(),
            record.agentId(),
            record.type(),
            record.priority(),
            record.status().getValue(),
            Jsons.toJson(objectMapper, record.payload()),
            Timestamp.from(record.createdAt()),
            Timestamp.from(record.updatedAt())
        );
    }

    @Override
    public void recordMessageEvent(MessageEvent event) {
        jdbcTemplate.update(
            "INSERT INTO agentqueue.message_events (message_id, org_id, event_type, details, created_at) "
                + "VALUES (?, ?, ?, ?::jsonb, ?)",
            event.messageId(),
            event.orgId(),
            event.eventType().getValue(),
            Jsons.toJson(objectMapper, event.details()),
            Timestamp.from(event.createdAt())
        );
    }

    @Override
    public void recordDlqMessage(DlqMessage entry) {
        jdbcTemplate.update(
            """
            INSERT INTO agentqueue.dlq_messages
                (org_id, message_id, type, original_message, error, can_replay, dlq_timestamp)
            VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            ON CONFLICT (org_id, message_id, dlq_timestamp) DO NOTHING
            """,
            entry.orgId(),
            entry.messageId(),
            entry.type(),
            Jsons.toJson(objectMapper, entry.originalMessage()),
            Jsons.toJson(objectMapper, entry.error().toMap()),
            entry.canReplay(),
            Timestamp.from(entry.dlqTimestamp())
        );
    }

    @Override
    public List<MessageEvent> findEvents(String messageId) {
        return jdbcTemplate.query(
            "SELECT * FROM agentqueue.message_events WHERE message_id = ? ORDER BY created_at ASC, id ASC",
            eventMapper,
            messageId
        );
    }

    @Override
    public Optional<MessageRecord> findMessage(String orgId, String messageId) {
        List<MessageRecord> records = jdbcTemplate.query(
            "SELECT * FROM agentqueue.messages WHERE org_id = ? AND message_id = ?",
            recordMapper,
            orgId, messageId
        );
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }
}
