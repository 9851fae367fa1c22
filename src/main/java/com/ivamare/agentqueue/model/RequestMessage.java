package com.ivamare.agentqueue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work submitted to an organization queue.
 *
 * <p>{@code type} is kept as the raw wire value so that a worker can still
 * route a kind it does not know to the fallback handler; producers reject
 * unknown kinds during validation.
 *
 * @param messageId Unique message identifier, preserved across retries and replays
 * @param version Schema version (semver)
 * @param orgId Owning organization
 * @param agentId Agent whose response queue receives the result (nullable)
 * @param type Operation kind wire value, see {@link MessageType}
 * @param priority Logical priority 0..3 (P0 highest)
 * @param goalId Optional goal reference
 * @param taskId Optional task reference
 * @param parentMessageId Optional parent message
 * @param createdBy Originator
 * @param createdAt Creation timestamp
 * @param retryCount Application-level retries already performed (nullable until defaulted)
 * @param maxRetries Retry budget (nullable until defaulted)
 * @param context Opaque handler input
 * @param metadata Opaque metadata; {@code dedup_key} overrides the computed fingerprint
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestMessage(
    @JsonProperty("message_id") @NotBlank String messageId,
    @JsonProperty("version") @NotBlank
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+$", message = "must be a semantic version like 1.0.0")
    String version,
    @JsonProperty("org_id") @NotBlank String orgId,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("type") @NotBlank
    @Pattern(regexp = TYPE_PATTERN, message = "must be a known message type")
    String type,
    @JsonProperty("priority") @NotNull @Min(0) @Max(3) Integer priority,
    @JsonProperty("goal_id") String goalId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("parent_message_id") String parentMessageId,
    @JsonProperty("created_by") @NotNull @Valid CreatedBy createdBy,
    @JsonProperty("created_at") @NotNull Instant createdAt,
    @JsonProperty("retry_count") @PositiveOrZero Integer retryCount,
    @JsonProperty("max_retries") @PositiveOrZero Integer maxRetries,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String REPLAYED_FROM = "replayed_from";

    static final String TYPE_PATTERN = "model_call|tool_call|agent_message|memory_save|memory_retrieve"
        + "|memory_update|agent_spawn|agent_terminate";

    public RequestMessage {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Creates a new P2 message with a random id, stamped now.
     *
     * @param orgId Owning organization
     * @param type Operation kind
     * @param createdBy Originator
     * @param context Handler input
     * @return A new RequestMessage instance
     */
    public static RequestMessage create(String orgId, MessageType type, CreatedBy createdBy,
                                        Map<String, Object> context) {
        return new RequestMessage(
            UUID.randomUUID().toString(), SCHEMA_VERSION, orgId, null, type.getValue(),
            Priority.P2.level(), null, null, null, createdBy, Instant.now(),
            null, null, context, Map.of()
        );
    }

    @JsonIgnore
    public Optional<MessageType> messageType() {
        return MessageType.find(type);
    }

    @JsonIgnore
    public Priority logicalPriority() {
        return Priority.parse(priority);
    }

    @JsonIgnore
    public int retryCountOrZero() {
        return retryCount != null ? retryCount : 0;
    }

    /**
     * Retry budget in force: the explicit value, else the per-type default.
     */
    @JsonIgnore
    public int effectiveMaxRetries() {
        if (maxRetries != null) {
            return maxRetries;
        }
        return messageType().map(MessageType::getDefaultMaxRetries).orElse(3);
    }

    @JsonIgnore
    public String userId() {
        return createdBy != null ? createdBy.id() : null;
    }

    /**
     * Fills absent retry counters. Explicit values, including zero, are kept.
     */
    public RequestMessage withDefaults() {
        if (retryCount != null && maxRetries != null) {
            return this;
        }
        return new RequestMessage(messageId, version, orgId, agentId, type, priority, goalId, taskId,
            parentMessageId, createdBy, createdAt, retryCountOrZero(), effectiveMaxRetries(), context, metadata);
    }

    public RequestMessage withPriority(Priority newPriority) {
        return new RequestMessage(messageId, version, orgId, agentId, type, newPriority.level(), goalId, taskId,
            parentMessageId, createdBy, createdAt, retryCount, maxRetries, context, metadata);
    }

    public RequestMessage withRetry(int newRetryCount, Priority newPriority) {
        return new RequestMessage(messageId, version, orgId, agentId, type, newPriority.level(), goalId, taskId,
            parentMessageId, createdBy, createdAt, newRetryCount, effectiveMaxRetries(), context, metadata);
    }

    /**
     * Copy for DLQ replay: retry count reset, provenance recorded in context.
     *
     * @param dlqId DLQ row the message is replayed from
     * @param dlqTimestamp When the message was dead-lettered
     * @return replayable copy with the same message id
     */
    public RequestMessage forReplay(long dlqId, Instant dlqTimestamp) {
        Map<String, Object> replayContext = new LinkedHashMap<>(context);
        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("dlq_id", dlqId);
        provenance.put("dlq_timestamp", dlqTimestamp != null ? dlqTimestamp.toString() : null);
        replayContext.put(REPLAYED_FROM, provenance);
        return new RequestMessage(messageId, version, orgId, agentId, type, priority, goalId, taskId,
            parentMessageId, createdBy, createdAt, 0, effectiveMaxRetries(), replayContext, metadata);
    }
}
