package com.ivamare.agentqueue.tracing;

import java.security.SecureRandom;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * W3C trace context carried in the {@code traceparent} header.
 *
 * @param traceId 32 lowercase hex characters
 * @param spanId 16 lowercase hex characters
 */
public record TraceContext(String traceId, String spanId) {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Pattern TRACEPARENT =
        Pattern.compile("^00-([0-9a-f]{32})-([0-9a-f]{16})-[0-9a-f]{2}$");
    private static final String INVALID_TRACE_ID = "0".repeat(32);

    public static TraceContext newRoot() {
        return new TraceContext(randomHex(16), randomHex(8));
    }

    /**
     * Same trace, fresh span id; one per hop.
     */
    public TraceContext child() {
        return new TraceContext(traceId, randomHex(8));
    }

    public String toTraceparent() {
        return "00-" + traceId + "-" + spanId + "-01";
    }

    public static Optional<TraceContext> parse(String traceparent) {
        if (traceparent == null) {
            return Optional.empty();
        }
        var matcher = TRACEPARENT.matcher(traceparent.trim());
        if (!matcher.matches() || INVALID_TRACE_ID.equals(matcher.group(1))) {
            return Optional.empty();
        }
        return Optional.of(new TraceContext(matcher.group(1), matcher.group(2)));
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
