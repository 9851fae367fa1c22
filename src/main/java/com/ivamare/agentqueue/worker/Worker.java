package com.ivamare.agentqueue.worker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Worker consuming an organization's request queue.
 *
 * <p>The worker deduplicates deliveries, dispatches them to registered handlers,
 * answers the requesting agent and drives retries through delay queues, the
 * dead-letter queue and poison quarantine. Deliveries are acknowledged manually
 * once disposed of and never requeued by the broker.
 *
 * <p>Example:
 * <pre>
 * Worker worker = Worker.builder()
 *     .orgId("acme")
 *     .connectionFactory(connectionFactory)
 *     .handlerRegistry(registry)
 *     .publisher(publisher)
 *     .topology(topology)
 *     .idempotencyStore(idempotencyStore)
 *     .poisonDetector(poisonDetector)
 *     .auditTrail(auditTrail)
 *     .concurrency(4)
 *     .build();
 *
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Worker {

    /**
     * Start consuming. Declares the organization topology first.
     */
    void start();

    /**
     * Stop the worker gracefully.
     *
     * <p>Stops consuming and waits for in-flight messages to complete within the timeout.
     *
     * @param timeout Maximum time to wait for in-flight messages
     * @return Future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop the worker immediately without waiting.
     */
    void stopNow();

    boolean isRunning();

    /**
     * @return count of messages currently being processed
     */
    int inFlightCount();

    String orgId();

    /**
     * @return consecutive acknowledgment or listener errors, reset on the next success
     */
    int getConsecutiveErrorCount();

    /**
     * Create a new worker builder.
     *
     * @return new builder instance
     */
    static WorkerBuilder builder() {
        return new WorkerBuilder();
    }
}
