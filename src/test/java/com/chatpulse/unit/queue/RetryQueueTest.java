package com.chatpulse.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatpulse.event.OperationEvent;
import com.chatpulse.event.OperationEventType;
import com.chatpulse.exception.DeliveryException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.QueueFullException;
import com.chatpulse.exception.TransportException;
import com.chatpulse.exception.ValidationException;
import com.chatpulse.queue.OperationStatus;
import com.chatpulse.queue.QueueStats;
import com.chatpulse.queue.QueuedOperation;
import com.chatpulse.queue.RetryQueue;
import com.chatpulse.support.TestClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RetryQueue covering band ordering, batching, capacity, retry backoff,
 * cancellation and pause/resume.
 */
class RetryQueueTest {

    private TestClient client;
    private RetryQueue<String> queue;

    /** Dispatched payloads in order, with the clock reading at dispatch time. */
    private final List<String> dispatched = new ArrayList<>();

    private final List<Instant> dispatchTimes = new ArrayList<>();
    private final Map<String, CompletableFuture<Void>> attempts = new LinkedHashMap<>();

    /** What the dispatcher answers: null leaves the attempt pending. */
    private CompletableFuture<Void> nextResult;

    @BeforeEach
    void setUp() {
        client = new TestClient();
        client.properties.getQueue().setMaxSize(10);
        client.properties.getQueue().setMaxRetries(3);
        client.properties.getQueue().setRetryDelayMs(1_000);
        client.properties.getQueue().setBatchSize(5);
        client.properties.getQueue().setProcessingIntervalMs(100);
        queue = new RetryQueue<>(client.context());
        queue.setDispatcher(operation -> {
            dispatched.add(operation.getPayload());
            dispatchTimes.add(client.scheduler.now());
            CompletableFuture<Void> attempt = nextResult != null ? nextResult : new CompletableFuture<>();
            attempts.put(operation.getPayload(), attempt);
            return attempt;
        });
    }

    private List<OperationEvent> events(OperationEventType type) {
        return client.published.ofType(OperationEvent.class, e -> e.getEventType() == type);
    }

    @Nested
    @DisplayName("Enqueue")
    class Enqueue {

        @Test
        @DisplayName("Enqueue publishes QUEUED and the operation starts PENDING")
        void enqueuePublishesQueued() {
            QueuedOperation<String> operation = queue.enqueue("hello", 3);

            assertThat(operation.getStatus()).isEqualTo(OperationStatus.PENDING);
            assertThat(operation.getAttempts()).isZero();
            assertThat(events(OperationEventType.QUEUED))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getOperationId()).isEqualTo(operation.getId());
                        assertThat(e.getPriority()).isEqualTo(3);
                    });
        }

        @Test
        @DisplayName("Priority outside 1..5 is rejected")
        void invalidPriority() {
            assertThatThrownBy(() -> queue.enqueue("x", 0))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_PRIORITY);
            assertThatThrownBy(() -> queue.enqueue("x", 6)).isInstanceOf(ValidationException.class);
            assertThat(queue.size()).isZero();
        }

        @Test
        @DisplayName("Enqueue at capacity throws QueueFullException and counts a drop")
        void rejectsAtCapacity() {
            client.properties.getQueue().setMaxSize(2);
            queue = new RetryQueue<>(client.context());
            queue.enqueue("a", 3);
            queue.enqueue("b", 3);

            assertThatThrownBy(() -> queue.enqueue("c", 1)).isInstanceOf(QueueFullException.class);
            assertThat(queue.size()).isEqualTo(2);
            assertThat(queue.getStats().getDropped()).isEqualTo(1);
        }

        @Test
        @DisplayName("In-flight operations still count toward capacity")
        void inFlightCountsTowardCapacity() {
            client.properties.getQueue().setMaxSize(2);
            RetryQueue<String> small = new RetryQueue<>(client.context());
            small.setDispatcher(operation -> new CompletableFuture<>());
            small.enqueue("a", 3);
            small.enqueue("b", 3);
            small.resume();
            client.scheduler.runDue();

            assertThat(small.getStats().getInFlight()).isEqualTo(2);
            assertThatThrownBy(() -> small.enqueue("c", 3)).isInstanceOf(QueueFullException.class);
        }
    }

    @Nested
    @DisplayName("Dispatch Order")
    class DispatchOrder {

        @Test
        @DisplayName("Bands drain in priority order, FIFO within a band")
        void priorityThenFifo() {
            queue.enqueue("low", 5);
            queue.enqueue("urgent-1", 1);
            queue.enqueue("normal", 3);
            queue.enqueue("urgent-2", 1);

            queue.resume();
            client.scheduler.runDue();

            assertThat(dispatched).containsExactly("urgent-1", "urgent-2", "normal", "low");
        }

        @Test
        @DisplayName("A tick dispatches at most batchSize operations")
        void batchSizeCapsTick() {
            for (int i = 0; i < 7; i++) {
                queue.enqueue("op-" + i, 3);
            }
            queue.resume();

            client.scheduler.runDue();
            assertThat(dispatched).hasSize(5);

            client.scheduler.advanceMillis(100);
            assertThat(dispatched).hasSize(7);
        }

        @Test
        @DisplayName("A future-scheduled head skips its band without blocking lower bands")
        void scheduledHeadSkipsBand() {
            Instant now = client.scheduler.now();
            queue.enqueue("later", 1, now.plusMillis(500));
            queue.enqueue("now", 2);
            queue.resume();

            client.scheduler.runDue();
            assertThat(dispatched).containsExactly("now");

            client.scheduler.advanceMillis(500);
            assertThat(dispatched).containsExactly("now", "later");
        }

        @Test
        @DisplayName("Nothing is dispatched while paused")
        void pausedQueueHoldsOperations() {
            queue.enqueue("a", 1);

            client.scheduler.advanceMillis(1_000);

            assertThat(queue.isPaused()).isTrue();
            assertThat(dispatched).isEmpty();
        }

        @Test
        @DisplayName("pause stops the tick and keeps queued content")
        void pauseKeepsContent() {
            queue.resume();
            queue.pause();
            queue.enqueue("a", 1);

            client.scheduler.advanceMillis(1_000);

            assertThat(dispatched).isEmpty();
            assertThat(queue.getStats().getBandSizes()).containsEntry(1, 1);
        }
    }

    @Nested
    @DisplayName("Delivery And Retry")
    class DeliveryAndRetry {

        @Test
        @DisplayName("A successful attempt completes the operation and publishes DELIVERED")
        void successfulDelivery() {
            nextResult = CompletableFuture.completedFuture(null);
            QueuedOperation<String> operation = queue.enqueue("hello", 2);
            queue.resume();

            client.scheduler.runDue();

            assertThat(operation.getCompletion()).isCompleted();
            assertThat(operation.getStatus()).isEqualTo(OperationStatus.DONE);
            assertThat(queue.size()).isZero();
            assertThat(queue.getStats().getProcessed()).isEqualTo(1);
            assertThat(events(OperationEventType.DELIVERED)).hasSize(1);
        }

        @Test
        @DisplayName("Failed attempts back off exponentially and fail terminally after maxRetries")
        void backoffThenTerminalFailure() {
            nextResult = CompletableFuture.failedFuture(new TransportException("socket closed"));
            Instant start = client.scheduler.now();
            QueuedOperation<String> operation = queue.enqueue("flaky", 3);
            queue.resume();

            client.scheduler.advanceMillis(5_000);

            assertThat(dispatchTimes).containsExactly(start, start.plusMillis(1_000), start.plusMillis(3_000));
            assertThat(operation.getAttempts()).isEqualTo(3);
            assertThat(operation.getStatus()).isEqualTo(OperationStatus.FAILED);
            assertThat(operation.getLastError()).isEqualTo("socket closed");

            List<OperationEvent> retries = events(OperationEventType.RETRY_SCHEDULED);
            assertThat(retries).extracting(OperationEvent::getRetryDelay)
                    .containsExactly(Duration.ofMillis(1_000), Duration.ofMillis(2_000));
            assertThat(events(OperationEventType.FAILED))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getAttempts()).isEqualTo(3));

            assertThatThrownBy(() -> operation.getCompletion().get())
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(DeliveryException.class);
            QueueStats stats = queue.getStats();
            assertThat(stats.getFailed()).isEqualTo(1);
            assertThat(stats.getRetried()).isEqualTo(2);
            assertThat(stats.getTotal()).isZero();
        }

        @Test
        @DisplayName("A retried operation goes back to the front of its band")
        void retryJumpsTheBand() {
            QueuedOperation<String> first = queue.enqueue("first", 3);
            queue.resume();
            client.scheduler.runDue();
            queue.enqueue("second", 3);
            queue.pause();

            attempts.get("first").completeExceptionally(new TransportException("boom"));
            client.scheduler.advanceMillis(1_000);
            dispatched.clear();
            queue.resume();
            client.scheduler.runDue();

            assertThat(first.getAttempts()).isEqualTo(1);
            assertThat(dispatched).containsExactly("first", "second");
        }

        @Test
        @DisplayName("A dispatcher that throws counts as a failed attempt")
        void throwingDispatcherIsAFailure() {
            queue.setDispatcher(operation -> {
                throw new TransportException("not writable");
            });
            QueuedOperation<String> operation = queue.enqueue("x", 1);
            queue.resume();

            client.scheduler.runDue();

            assertThat(operation.getAttempts()).isEqualTo(1);
            assertThat(queue.getStats().getAwaitingRetry()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel removes a queued operation and fails its completion")
        void cancelQueued() {
            QueuedOperation<String> operation = queue.enqueue("x", 4);

            assertThat(queue.cancel(operation.getId())).isTrue();

            assertThat(queue.size()).isZero();
            assertThatThrownBy(() -> operation.getCompletion().get())
                    .hasCauseInstanceOf(DeliveryException.class)
                    .cause()
                    .satisfies(e -> assertThat(((DeliveryException) e).getErrorCode())
                            .isEqualTo(ErrorCode.OPERATION_CANCELLED));
            assertThat(events(OperationEventType.CANCELLED)).hasSize(1);
        }

        @Test
        @DisplayName("cancel removes an operation waiting out its backoff")
        void cancelAwaitingRetry() {
            nextResult = CompletableFuture.failedFuture(new TransportException("boom"));
            QueuedOperation<String> operation = queue.enqueue("x", 1);
            queue.resume();
            client.scheduler.runDue();

            assertThat(queue.cancel(operation.getId())).isTrue();
            client.scheduler.advanceMillis(5_000);

            assertThat(dispatched).hasSize(1);
            assertThat(queue.size()).isZero();
        }

        @Test
        @DisplayName("In-flight and unknown operations cannot be cancelled")
        void cannotCancelInFlight() {
            QueuedOperation<String> operation = queue.enqueue("x", 1);
            queue.resume();
            client.scheduler.runDue();

            assertThat(queue.cancel(operation.getId())).isFalse();
            assertThat(queue.cancel("missing")).isFalse();
        }

        @Test
        @DisplayName("shutdown clears the queue and rejects further enqueues")
        void shutdownRejectsEnqueue() {
            queue.enqueue("a", 1);
            queue.enqueue("b", 2);

            queue.shutdown();

            assertThat(queue.size()).isZero();
            assertThat(events(OperationEventType.CANCELLED)).hasSize(2);
            assertThatThrownBy(() -> queue.enqueue("c", 1))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_STATE);
        }
    }
}
