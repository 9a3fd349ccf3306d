package com.chatpulse.queue;

import com.chatpulse.config.ChatPulseProperties;
import com.chatpulse.config.ClientContext;
import com.chatpulse.event.EventPublisherHelper;
import com.chatpulse.event.OperationEventType;
import com.chatpulse.exception.DeliveryException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.QueueFullException;
import com.chatpulse.exception.ValidationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, priority-banded outbound queue with retry and exponential backoff.
 *
 * <p>Five FIFO bands, 1 being the most urgent. A dispatch tick drains bands in order and
 * hands at most {@code batchSize} due operations to the {@link OperationDispatcher}. A band
 * whose head is scheduled in the future is skipped for that tick without holding back the
 * bands after it.
 *
 * <p>A failed attempt puts the operation aside for {@code retryDelay * 2^(attempts-1)} and
 * then back at the front of its band. When {@code attempts} reaches {@code maxRetries} the
 * operation is dropped, its completion fails, and a terminal {@code FAILED} event is published.
 *
 * <p>Capacity counts everything the queue owns (queued, in flight and awaiting retry).
 * An enqueue at capacity is rejected without touching the queue.
 *
 * <p>The queue starts paused. All state is guarded by one lock; the dispatcher is called
 * and events are published only after the lock is released.
 */
public class RetryQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryQueue.class);

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;

    private final ClientContext context;
    private final EventPublisherHelper events;
    private final int maxSize;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final int batchSize;
    private final Duration processingInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ArrayDeque<QueuedOperation<T>>> bands = new ArrayList<>();
    private final Map<String, QueuedOperation<T>> inFlight = new HashMap<>();
    private final Map<String, QueuedOperation<T>> awaitingRetry = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> retryTimers = new HashMap<>();

    private OperationDispatcher<T> dispatcher;
    private ScheduledFuture<?> tickTask;
    private boolean paused = true;
    private boolean shutdown;

    private long processed;
    private long failed;
    private long retried;
    private long dropped;

    public RetryQueue(ClientContext context) {
        this.context = context;
        this.events = context.getEvents();
        ChatPulseProperties.Queue config = context.getProperties().getQueue();
        this.maxSize = config.getMaxSize();
        this.maxAttempts = config.getMaxRetries();
        this.retryDelayMs = config.getRetryDelayMs();
        this.batchSize = config.getBatchSize();
        this.processingInterval = Duration.ofMillis(config.getProcessingIntervalMs());
        for (int p = HIGHEST_PRIORITY; p <= LOWEST_PRIORITY; p++) {
            bands.add(new ArrayDeque<>());
        }
    }

    public void setDispatcher(OperationDispatcher<T> dispatcher) {
        this.dispatcher = dispatcher;
    }

    public QueuedOperation<T> enqueue(T payload, int priority) {
        return enqueue(payload, priority, null);
    }

    /**
     * Adds an operation to its priority band.
     *
     * @param scheduledAt earliest dispatch time, or null for now
     * @throws ValidationException if priority is outside 1..5
     * @throws QueueFullException if the queue already owns {@code maxSize} operations
     */
    public QueuedOperation<T> enqueue(T payload, int priority, Instant scheduledAt) {
        if (priority < HIGHEST_PRIORITY || priority > LOWEST_PRIORITY) {
            throw new ValidationException(
                    ErrorCode.INVALID_PRIORITY,
                    "Priority must be between " + HIGHEST_PRIORITY + " and " + LOWEST_PRIORITY + ", got " + priority);
        }
        Instant now = context.now();
        QueuedOperation<T> operation;

        lock.lock();
        try {
            if (shutdown) {
                throw new ValidationException(ErrorCode.INVALID_STATE, "Queue is shut down");
            }
            if (sizeLocked() >= maxSize) {
                dropped++;
                throw new QueueFullException(maxSize);
            }
            operation = new QueuedOperation<>(
                    UUID.randomUUID().toString(),
                    payload,
                    priority,
                    maxAttempts,
                    now,
                    scheduledAt != null ? scheduledAt : now);
            band(priority).addLast(operation);
        } finally {
            lock.unlock();
        }

        log.debug("Operation queued: id={}, priority={}, scheduledAt={}", operation.getId(), priority,
                operation.getScheduledAt());
        events.publishOperation(this, OperationEventType.QUEUED, operation.getId(), priority, 0, null, null);
        return operation;
    }

    /** Starts the dispatch tick. No-op when already running. */
    public void resume() {
        lock.lock();
        try {
            if (!paused || shutdown) {
                return;
            }
            paused = false;
            tickTask = context.getScheduler().scheduleAtFixedRate(this::processTick, processingInterval);
        } finally {
            lock.unlock();
        }
        log.info("Retry queue resumed");
    }

    /** Stops the dispatch tick. Queued content, in-flight attempts and retry timers are kept. */
    public void pause() {
        ScheduledFuture<?> task;
        lock.lock();
        try {
            if (paused) {
                return;
            }
            paused = true;
            task = tickTask;
            tickTask = null;
        } finally {
            lock.unlock();
        }
        if (task != null) {
            task.cancel(false);
        }
        log.info("Retry queue paused");
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * One dispatch round: bands 1 to 5, FIFO within a band, at most {@code batchSize} operations.
     * Public so the tick can be driven directly.
     */
    public void processTick() {
        List<QueuedOperation<T>> batch = new ArrayList<>(batchSize);
        lock.lock();
        try {
            if (paused || shutdown || dispatcher == null) {
                return;
            }
            Instant now = context.now();
            for (ArrayDeque<QueuedOperation<T>> band : bands) {
                while (batch.size() < batchSize) {
                    QueuedOperation<T> head = band.peekFirst();
                    if (head == null || !head.isDue(now)) {
                        break;
                    }
                    band.pollFirst();
                    head.markInFlight();
                    inFlight.put(head.getId(), head);
                    batch.add(head);
                }
                if (batch.size() >= batchSize) {
                    break;
                }
            }
        } finally {
            lock.unlock();
        }

        for (QueuedOperation<T> operation : batch) {
            dispatch(operation);
        }
    }

    private void dispatch(QueuedOperation<T> operation) {
        CompletableFuture<Void> attempt;
        try {
            attempt = dispatcher.dispatch(operation);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        attempt.whenComplete((ignored, error) -> {
            if (error == null) {
                onDelivered(operation);
            } else {
                onAttemptFailed(operation, unwrap(error));
            }
        });
    }

    private void onDelivered(QueuedOperation<T> operation) {
        lock.lock();
        try {
            if (inFlight.remove(operation.getId()) == null) {
                return;
            }
            operation.markDone();
            processed++;
        } finally {
            lock.unlock();
        }
        log.debug("Operation delivered: id={}, attempts={}", operation.getId(), operation.getAttempts() + 1);
        operation.getCompletion().complete(null);
        events.publishOperation(
                this,
                OperationEventType.DELIVERED,
                operation.getId(),
                operation.getPriority(),
                operation.getAttempts(),
                null,
                null);
    }

    private void onAttemptFailed(QueuedOperation<T> operation, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        int attempts;
        Duration delay = null;

        lock.lock();
        try {
            if (inFlight.remove(operation.getId()) == null) {
                return;
            }
            attempts = operation.recordFailure(message);
            if (attempts < operation.getMaxAttempts() && !shutdown) {
                delay = retryDelay(attempts);
                Instant retryAt = context.now().plus(delay);
                operation.markPending(retryAt);
                awaitingRetry.put(operation.getId(), operation);
                retried++;
                retryTimers.put(
                        operation.getId(),
                        context.getScheduler().schedule(() -> requeue(operation.getId()), retryAt));
            } else {
                operation.markFailed();
                failed++;
            }
        } finally {
            lock.unlock();
        }

        if (delay != null) {
            log.warn(
                    "Operation {} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation.getId(),
                    attempts,
                    operation.getMaxAttempts(),
                    delay.toMillis(),
                    message);
            events.publishOperation(
                    this,
                    OperationEventType.RETRY_SCHEDULED,
                    operation.getId(),
                    operation.getPriority(),
                    attempts,
                    delay,
                    message);
        } else {
            log.error("Operation {} failed permanently after {} attempts: {}", operation.getId(), attempts, message);
            operation.getCompletion()
                    .completeExceptionally(new DeliveryException(
                            ErrorCode.DELIVERY_FAILED,
                            "Operation " + operation.getId() + " failed after " + attempts + " attempts: " + message,
                            error));
            events.publishOperation(
                    this,
                    OperationEventType.FAILED,
                    operation.getId(),
                    operation.getPriority(),
                    attempts,
                    null,
                    message);
        }
    }

    /** Moves an operation whose backoff elapsed to the front of its band. */
    private void requeue(String operationId) {
        lock.lock();
        try {
            retryTimers.remove(operationId);
            QueuedOperation<T> operation = awaitingRetry.remove(operationId);
            if (operation == null) {
                return;
            }
            band(operation.getPriority()).addFirst(operation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a queued or backing-off operation. In-flight operations cannot be recalled.
     *
     * @return true if the operation was removed
     */
    public boolean cancel(String operationId) {
        QueuedOperation<T> removed = null;
        ScheduledFuture<?> timer = null;
        lock.lock();
        try {
            for (ArrayDeque<QueuedOperation<T>> band : bands) {
                Iterator<QueuedOperation<T>> it = band.iterator();
                while (it.hasNext()) {
                    QueuedOperation<T> candidate = it.next();
                    if (candidate.getId().equals(operationId)) {
                        it.remove();
                        removed = candidate;
                        break;
                    }
                }
                if (removed != null) {
                    break;
                }
            }
            if (removed == null) {
                removed = awaitingRetry.remove(operationId);
                timer = retryTimers.remove(operationId);
            }
        } finally {
            lock.unlock();
        }
        if (timer != null) {
            timer.cancel(false);
        }
        if (removed == null) {
            return false;
        }
        abandon(removed, "cancelled");
        return true;
    }

    /** Drops everything queued or backing off. Returns the number removed. */
    public int clear() {
        List<QueuedOperation<T>> removed = new ArrayList<>();
        List<ScheduledFuture<?>> timers;
        lock.lock();
        try {
            for (ArrayDeque<QueuedOperation<T>> band : bands) {
                removed.addAll(band);
                band.clear();
            }
            removed.addAll(awaitingRetry.values());
            awaitingRetry.clear();
            timers = new ArrayList<>(retryTimers.values());
            retryTimers.clear();
        } finally {
            lock.unlock();
        }
        timers.forEach(timer -> timer.cancel(false));
        removed.forEach(operation -> abandon(operation, "cleared"));
        if (!removed.isEmpty()) {
            log.info("Retry queue cleared: {} operations removed", removed.size());
        }
        return removed.size();
    }

    /** Pauses, clears and rejects any further enqueue. */
    public void shutdown() {
        pause();
        lock.lock();
        try {
            shutdown = true;
        } finally {
            lock.unlock();
        }
        clear();
    }

    private void abandon(QueuedOperation<T> operation, String reason) {
        operation.markFailed();
        operation.getCompletion()
                .completeExceptionally(new DeliveryException(
                        ErrorCode.OPERATION_CANCELLED, "Operation " + operation.getId() + " " + reason));
        events.publishOperation(
                this,
                OperationEventType.CANCELLED,
                operation.getId(),
                operation.getPriority(),
                operation.getAttempts(),
                null,
                reason);
    }

    public int size() {
        lock.lock();
        try {
            return sizeLocked();
        } finally {
            lock.unlock();
        }
    }

    public QueueStats getStats() {
        lock.lock();
        try {
            Map<Integer, Integer> bandSizes = new LinkedHashMap<>();
            for (int p = HIGHEST_PRIORITY; p <= LOWEST_PRIORITY; p++) {
                bandSizes.put(p, band(p).size());
            }
            return QueueStats.builder()
                    .bandSizes(bandSizes)
                    .inFlight(inFlight.size())
                    .awaitingRetry(awaitingRetry.size())
                    .total(sizeLocked())
                    .maxSize(maxSize)
                    .paused(paused)
                    .processed(processed)
                    .failed(failed)
                    .retried(retried)
                    .dropped(dropped)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    Duration retryDelay(int attempts) {
        int shift = Math.min(attempts - 1, 30);
        return Duration.ofMillis(retryDelayMs * (1L << shift));
    }

    private int sizeLocked() {
        int queued = 0;
        for (ArrayDeque<QueuedOperation<T>> band : bands) {
            queued += band.size();
        }
        return queued + inFlight.size() + awaitingRetry.size();
    }

    private ArrayDeque<QueuedOperation<T>> band(int priority) {
        return bands.get(priority - HIGHEST_PRIORITY);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
