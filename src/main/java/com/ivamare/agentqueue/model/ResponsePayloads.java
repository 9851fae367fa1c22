package com.ivamare.agentqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for payloads published to agent response queues.
 *
 * <p>Every payload carries {@code request_id} and {@code type}; all but
 * {@code error} carry the request's {@code created_at} as {@code timestamp}.
 */
public final class ResponsePayloads {

    public static final String TYPE_RESULT = "result";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_ACKNOWLEDGMENT = "acknowledgment";
    public static final String TYPE_PROGRESS = "progress";
    public static final String TYPE_STREAM_CHUNK = "stream_chunk";
    public static final String TYPE_STREAM_COMPLETE = "stream_complete";

    private ResponsePayloads() {
    }

    public static Map<String, Object> result(RequestMessage request, Object result) {
        Map<String, Object> payload = base(request, TYPE_RESULT);
        payload.put("result", result);
        return stamp(payload, request);
    }

    public static Map<String, Object> acknowledgment(RequestMessage request) {
        return stamp(base(request, TYPE_ACKNOWLEDGMENT), request);
    }

    public static Map<String, Object> progress(RequestMessage request, int progressPercent, String status) {
        Map<String, Object> payload = base(request, TYPE_PROGRESS);
        payload.put("progress", progressPercent);
        if (status != null) {
            payload.put("status", status);
        }
        return stamp(payload, request);
    }

    public static Map<String, Object> streamChunk(RequestMessage request, Object chunk, int chunkIndex) {
        Map<String, Object> payload = base(request, TYPE_STREAM_CHUNK);
        payload.put("chunk", chunk);
        payload.put("chunk_index", chunkIndex);
        return stamp(payload, request);
    }

    public static Map<String, Object> streamComplete(RequestMessage request, int totalChunks,
                                                     Map<String, Object> finalMetadata) {
        Map<String, Object> payload = base(request, TYPE_STREAM_COMPLETE);
        payload.put("total_chunks", totalChunks);
        if (finalMetadata != null && !finalMetadata.isEmpty()) {
            payload.put("metadata", finalMetadata);
        }
        return stamp(payload, request);
    }

    /**
     * Error payload; tolerates a missing request.
     */
    public static Map<String, Object> error(RequestMessage request, String errorType, String errorMessage) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", request != null ? request.messageId() : null);
        payload.put("type", TYPE_ERROR);
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", errorType);
        error.put("message", errorMessage);
        payload.put("error", error);
        return payload;
    }

    private static Map<String, Object> base(RequestMessage request, String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", request.messageId());
        payload.put("type", type);
        return payload;
    }

    private static Map<String, Object> stamp(Map<String, Object> payload, RequestMessage request) {
        payload.put("timestamp", request.createdAt() != null ? request.createdAt().toString() : null);
        return payload;
    }
}
