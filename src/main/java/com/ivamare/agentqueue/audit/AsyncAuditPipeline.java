package com.ivamare.agentqueue.audit;

import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-blocking audit sink: writes are buffered in a bounded queue and applied
 * to the delegate by a single drainer thread.
 *
 * <p>When the buffer is full the write is dropped and counted. Delegate
 * failures are logged and counted, never propagated.
 */
public class AsyncAuditPipeline implements AuditSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditPipeline.class);

    enum Operation {
        UPSERT_MESSAGE("upsert_message"),
        MESSAGE_EVENT("message_event"),
        DLQ_MESSAGE("dlq_message");

        private final String value;

        Operation(String value) {
            this.value = value;
        }
    }

    private record PendingWrite(Operation operation, Object payload) {}

    private final AuditSink delegate;
    private final QueueMetrics metrics;
    private final BlockingQueue<PendingWrite> buffer;
    private final int batchSize;
    private final Duration flushInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger pending = new AtomicInteger(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong written = new AtomicLong(0);

    private volatile Thread drainer;

    public AsyncAuditPipeline(AuditSink delegate, QueueMetrics metrics, int capacity, int batchSize,
                              Duration flushInterval) {
        if (capacity < 1 || batchSize < 1) {
            throw new IllegalArgumentException("capacity and batchSize must be positive");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
    }

    /**
     * Start the drainer thread. Writes offered before start are kept in the buffer.
     */
    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        Thread thread = new Thread(this::drainLoop, "agentqueue-audit-drainer");
        thread.setDaemon(true);
        drainer = thread;
        thread.start();
        log.info("Audit pipeline started (capacity={}, batchSize={})", buffer.remainingCapacity() + buffer.size(),
            batchSize);
    }

    @Override
    public void upsertMessage(MessageRecord record) {
        offer(Operation.UPSERT_MESSAGE, record);
    }

    @Override
    public void recordMessageEvent(MessageEvent event) {
        offer(Operation.MESSAGE_EVENT, event);
    }

    @Override
    public void recordDlqMessage(DlqMessage entry) {
        offer(Operation.DLQ_MESSAGE, entry);
    }

    /**
     * Wait until every buffered write has been applied.
     *
     * @param timeout Maximum time to wait
     * @return true if the buffer drained in time
     */
    public boolean awaitDrained(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        running.set(false);
        Thread thread = drainer;
        if (thread != null) {
            try {
                thread.join(Math.max(1_000L, flushInterval.toMillis() * 5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!buffer.isEmpty()) {
            log.warn("Audit pipeline closed with {} unwritten entries", buffer.size());
        }
        log.info("Audit pipeline stopped (written={}, dropped={}, failed={})",
            written.get(), dropped.get(), failed.get());
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long writtenCount() {
        return written.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isDrainerAlive() {
        Thread thread = drainer;
        return thread != null && thread.isAlive();
    }

    private void offer(Operation operation, Object payload) {
        pending.incrementAndGet();
        if (closed.get() || !buffer.offer(new PendingWrite(operation, payload))) {
            pending.decrementAndGet();
            long total = dropped.incrementAndGet();
            metrics.auditDropped(operation.value);
            log.warn("Audit buffer full, dropped {} (total dropped={})", operation.value, total);
        }
    }

    private void drainLoop() {
        List<PendingWrite> batch = new ArrayList<>(batchSize);
        while (running.get() || !buffer.isEmpty()) {
            try {
                PendingWrite first = buffer.poll(flushInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                buffer.drainTo(batch, batchSize - 1);
                for (PendingWrite write : batch) {
                    try {
                        apply(write);
                    } finally {
                        pending.decrementAndGet();
                    }
                }
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Audit drainer interrupted with {} entries buffered", buffer.size());
                return;
            }
        }
    }

    private void apply(PendingWrite write) {
        try {
            switch (write.operation()) {
                case UPSERT_MESSAGE -> delegate.upsertMessage((MessageRecord) write.payload());
                case MESSAGE_EVENT -> delegate.recordMessageEvent((MessageEvent) write.payload());
                case DLQ_MESSAGE -> delegate.recordDlqMessage((DlqMessage) write.payload());
            }
            written.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            metrics.auditFailure(write.operation().value);
            log.warn("Audit write {} failed: {}", write.operation().value, e.getMessage());
        }
    }
}
