package com.ivamare.agentqueue.tracing;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves trace context between AMQP headers and the logging MDC.
 */
public final class TracePropagation {

    public static final String TRACEPARENT_HEADER = "traceparent";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_MESSAGE_ID = "messageId";
    public static final String MDC_ORG_ID = "orgId";

    private TracePropagation() {
    }

    /**
     * Headers carrying the given context, merged over {@code base}.
     */
    public static Map<String, Object> inject(TraceContext context, Map<String, Object> base) {
        Map<String, Object> headers = new LinkedHashMap<>();
        if (base != null) {
            headers.putAll(base);
        }
        headers.put(TRACEPARENT_HEADER, context.toTraceparent());
        return headers;
    }

    /**
     * Continue the trace found in the headers with a new span, or start a new trace.
     */
    public static TraceContext continueFrom(Map<String, Object> headers) {
        Object value = headers != null ? headers.get(TRACEPARENT_HEADER) : null;
        return TraceContext.parse(value != null ? value.toString() : null)
            .map(TraceContext::child)
            .orElseGet(TraceContext::newRoot);
    }

    /**
     * Continue the trace bound to the current thread's MDC, or start a new one.
     */
    public static TraceContext currentOrNew() {
        String traceId = MDC.get(MDC_TRACE_ID);
        if (traceId != null && traceId.matches("[0-9a-f]{32}")) {
            return new TraceContext(traceId, "0".repeat(16)).child();
        }
        return TraceContext.newRoot();
    }

    /**
     * Bind trace and message identifiers to the MDC until the scope is closed.
     */
    public static MdcScope open(TraceContext context, String messageId, String orgId) {
        return new MdcScope(context, messageId, orgId);
    }

    /**
     * Restores the MDC entries it replaced.
     */
    public static final class MdcScope implements AutoCloseable {

        private final Map<String, String> previous = new LinkedHashMap<>();

        private MdcScope(TraceContext context, String messageId, String orgId) {
            put(MDC_TRACE_ID, context.traceId());
            put(MDC_MESSAGE_ID, messageId);
            put(MDC_ORG_ID, orgId);
        }

        private void put(String key, String value) {
            previous.put(key, MDC.get(key));
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value != null) {
                    MDC.put(key, value);
                } else {
                    MDC.remove(key);
                }
            });
        }
    }
}
