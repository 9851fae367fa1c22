package com.ivamare.agentqueue.dedup;

import com.ivamare.agentqueue.TestMessages;
import com.ivamare.agentqueue.model.MessageType;
import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DedupKeys")
class DedupKeysTest {

    private final DedupKeys dedupKeys = new DedupKeys(TestMessages.MAPPER);

    @Test
    @DisplayName("should produce a 64-character hex digest")
    void shouldProduceHexDigest() {
        String key = dedupKeys.compute(TestMessages.message("acme", MessageType.TOOL_CALL));

        assertTrue(key.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("should ignore priority, retry counters and replay provenance")
    void shouldIgnoreVolatileFields() {
        RequestMessage message = TestMessages.message("acme", MessageType.TOOL_CALL);
        String original = dedupKeys.compute(message);

        assertEquals(original, dedupKeys.compute(message.withRetry(2, Priority.P3)));
        assertEquals(original, dedupKeys.compute(message.withDefaults().withPriority(Priority.P0)));
        assertEquals(original, dedupKeys.compute(message.forReplay(7L, Instant.now())));
    }

    @Test
    @DisplayName("should not depend on context key order")
    void shouldIgnoreContextOrder() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", Map.of("y", 2, "x", 1));
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", Map.of("x", 1, "y", 2));
        ba.put("a", 1);
        RequestMessage base = TestMessages.message("acme", MessageType.TOOL_CALL);

        assertEquals(dedupKeys.compute(withContext(base, ab)), dedupKeys.compute(withContext(base, ba)));
    }

    @Test
    @DisplayName("should change when the context changes")
    void shouldChangeWithContext() {
        RequestMessage base = TestMessages.message("acme", MessageType.TOOL_CALL);

        assertNotEquals(dedupKeys.compute(base), dedupKeys.compute(withContext(base, Map.of("prompt", "bye"))));
    }

    @Test
    @DisplayName("should use an explicit dedup_key verbatim")
    void shouldUseExplicitOverride() {
        RequestMessage base = TestMessages.message("acme", MessageType.TOOL_CALL);
        RequestMessage overridden = new RequestMessage(base.messageId(), base.version(), base.orgId(), base.agentId(),
            base.type(), base.priority(), null, null, null, base.createdBy(), base.createdAt(), null, null,
            base.context(), Map.of(DedupKeys.OVERRIDE_KEY, "order-123"));

        assertEquals("order-123", dedupKeys.compute(overridden));
    }

    private static RequestMessage withContext(RequestMessage m, Map<String, Object> context) {
        return new RequestMessage(m.messageId(), m.version(), m.orgId(), m.agentId(), m.type(), m.priority(),
            m.goalId(), m.taskId(), m.parentMessageId(), m.createdBy(), m.createdAt(), m.retryCount(),
            m.maxRetries(), context, m.metadata());
    }
}
