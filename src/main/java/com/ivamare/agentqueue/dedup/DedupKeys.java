package com.ivamare.agentqueue.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.agentqueue.model.RequestMessage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic fingerprint of a message's stable fields.
 *
 * <p>Priority, retry counters, timestamps and replay provenance are excluded so
 * that a redelivery, a retry and a replay of one logical message share a key.
 * A non-blank {@code metadata.dedup_key} is used verbatim.
 */
public final class DedupKeys {

    public static final String OVERRIDE_KEY = "dedup_key";

    private final ObjectMapper canonicalMapper;

    public DedupKeys(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String compute(RequestMessage message) {
        Object override = message.metadata().get(OVERRIDE_KEY);
        if (override instanceof String s && !s.isBlank()) {
            return s;
        }

        Map<String, Object> stable = new TreeMap<>();
        stable.put("org_id", message.orgId());
        stable.put("message_id", message.messageId());
        stable.put("type", message.type());
        stable.put("agent_id", message.agentId());
        stable.put("goal_id", message.goalId());
        stable.put("task_id", message.taskId());
        stable.put("parent_message_id", message.parentMessageId());
        if (message.createdBy() != null) {
            Map<String, Object> createdBy = new LinkedHashMap<>();
            createdBy.put("id", message.createdBy().id());
            createdBy.put("type", message.createdBy().type());
            stable.put("created_by", createdBy);
        }
        Map<String, Object> context = new HashMap<>(message.context());
        context.remove(RequestMessage.REPLAYED_FROM);
        stable.put("context", context);
        stable.put("metadata", message.metadata());

        try {
            byte[] canonical = canonicalMapper.writeValueAsString(stable).getBytes(StandardCharsets.UTF_8);
            return sha256Hex(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message " + message.messageId() + " is not serializable", e);
        }
    }

    private static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            StringBuilder sb = new StringBuilder(64);
            for (byte b : digest.digest(data)) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
