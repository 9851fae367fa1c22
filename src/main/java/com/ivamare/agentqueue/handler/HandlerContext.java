package com.ivamare.agentqueue.handler;

import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.model.ResponsePayloads;

import java.util.Map;
import java.util.Objects;

/**
 * Context passed to message handlers.
 *
 * <p>Besides retry state, it lets long-running handlers report acknowledgment,
 * progress and streamed chunks to the requesting agent before the worker sends
 * the final result.
 */
public final class HandlerContext {

    private final RequestMessage message;
    private final String dedupKey;
    private final String responseAgentId;
    private final ResponseEmitter emitter;
    private int chunkIndex;

    public HandlerContext(RequestMessage message, String dedupKey, String responseAgentId, ResponseEmitter emitter) {
        this.message = Objects.requireNonNull(message, "message");
        this.dedupKey = dedupKey;
        this.responseAgentId = responseAgentId;
        this.emitter = emitter != null ? emitter : ResponseEmitter.discarding();
    }

    public RequestMessage message() {
        return message;
    }

    public String dedupKey() {
        return dedupKey;
    }

    public int retryCount() {
        return message.retryCountOrZero();
    }

    public int maxRetries() {
        return message.effectiveMaxRetries();
    }

    /**
     * Agent that receives responses for this message, or null when no agent is known.
     */
    public String responseAgentId() {
        return responseAgentId;
    }

    /**
     * True when a failure of this attempt will not be retried.
     */
    public boolean isLastAttempt() {
        return retryCount() >= maxRetries();
    }

    public void acknowledge() {
        emitter.emit(ResponsePayloads.acknowledgment(message));
    }

    public void progress(int percent, String status) {
        emitter.emit(ResponsePayloads.progress(message, percent, status));
    }

    /**
     * Emit the next chunk of a streamed result; chunk indexes are assigned in order.
     */
    public synchronized void streamChunk(Object chunk) {
        emitter.emit(ResponsePayloads.streamChunk(message, chunk, chunkIndex++));
    }

    public synchronized void streamComplete(Map<String, Object> finalMetadata) {
        emitter.emit(ResponsePayloads.streamComplete(message, chunkIndex, finalMetadata));
    }

    public synchronized int chunksEmitted() {
        return chunkIndex;
    }
}
