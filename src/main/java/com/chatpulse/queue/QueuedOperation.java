package com.chatpulse.queue;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;

/**
 * One outbound operation owned by the {@link RetryQueue}. Priority is fixed at enqueue time;
 * {@code attempts} only moves when a delivery attempt fails.
 *
 * <p>Mutable state is changed by the queue under its lock; other readers see a best-effort view.
 */
@Getter
public class QueuedOperation<T> {

    private final String id;
    private final T payload;
    private final int priority;
    private final int maxAttempts;
    private final Instant createdAt;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private volatile int attempts;
    private volatile Instant scheduledAt;
    private volatile OperationStatus status = OperationStatus.PENDING;
    private volatile String lastError;

    QueuedOperation(String id, T payload, int priority, int maxAttempts, Instant createdAt, Instant scheduledAt) {
        this.id = id;
        this.payload = payload;
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.createdAt = createdAt;
        this.scheduledAt = scheduledAt;
    }

    boolean isDue(Instant now) {
        return !scheduledAt.isAfter(now);
    }

    void markInFlight() {
        status = OperationStatus.IN_FLIGHT;
    }

    /** Records a failed attempt and returns the new attempt count. */
    int recordFailure(String error) {
        lastError = error;
        return ++attempts;
    }

    void markPending(Instant nextAttemptAt) {
        status = OperationStatus.PENDING;
        scheduledAt = nextAttemptAt;
    }

    void markDone() {
        status = OperationStatus.DONE;
    }

    void markFailed() {
        status = OperationStatus.FAILED;
    }
}
