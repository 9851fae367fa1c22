package com.ivamare.agentqueue.audit;

import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageRecord;

import java.util.Map;

/**
 * Replaces message content with a marker before it reaches audit storage.
 */
public final class AuditRedactor {

    public static final Map<String, Object> REDACTED = Map.of("redacted", true);

    private final boolean enabled;

    public AuditRedactor(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public MessageRecord redact(MessageRecord record) {
        return enabled ? record.withPayload(REDACTED) : record;
    }

    public MessageEvent redact(MessageEvent event) {
        return enabled && event.details() != null ? event.withDetails(REDACTED) : event;
    }

    public DlqMessage redact(DlqMessage entry) {
        return enabled ? entry.withContent(REDACTED, new DlqMessage.Failure("redacted", "redacted")) : entry;
    }
}
