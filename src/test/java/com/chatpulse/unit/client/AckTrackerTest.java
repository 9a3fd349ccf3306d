package com.chatpulse.unit.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatpulse.client.AckTracker;
import com.chatpulse.exception.ChatPulseException;
import com.chatpulse.exception.ClientTimeoutException;
import com.chatpulse.exception.DeliveryException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.support.TestClient;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AckTrackerTest {

    private TestClient client;
    private AckTracker ackTracker;

    @BeforeEach
    void setUp() {
        client = new TestClient();
        client.properties.getQueue().setAckTimeoutMs(10_000);
        ackTracker = new AckTracker(client.context());
    }

    private static ChatPulseException failureOf(CompletableFuture<Void> future) {
        assertThat(future).isCompletedExceptionally();
        return (ChatPulseException) future.handle((ok, e) -> e).join();
    }

    @Test
    @DisplayName("An ack completes the matching await")
    void ackCompletes() {
        CompletableFuture<Void> await = ackTracker.register("op-1");

        ackTracker.onAck("op-1");

        assertThat(await).isCompleted();
        assertThat(ackTracker.getPendingCount()).isZero();
        assertThat(client.scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("No ack within the timeout fails the await with ACK_TIMEOUT")
    void timesOut() {
        CompletableFuture<Void> await = ackTracker.register("op-1");

        client.scheduler.advanceMillis(10_000);

        ChatPulseException failure = failureOf(await);
        assertThat(failure).isInstanceOf(ClientTimeoutException.class);
        assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.ACK_TIMEOUT);
        assertThat(ackTracker.getPendingCount()).isZero();
    }

    @Test
    @DisplayName("A server error for the ref fails the await")
    void errorFails() {
        CompletableFuture<Void> await = ackTracker.register("op-1");

        boolean matched = ackTracker.onError("op-1", "bad_target", "no such chat");

        assertThat(matched).isTrue();
        assertThat(failureOf(await)).isInstanceOf(DeliveryException.class);
    }

    @Test
    @DisplayName("Errors and acks for unknown refs are ignored")
    void unknownRefs() {
        ackTracker.onAck("ghost");

        assertThat(ackTracker.onError("ghost", "x", "y")).isFalse();
        assertThat(ackTracker.onError(null, "x", "y")).isFalse();
    }

    @Test
    @DisplayName("Re-registering a ref fails the older await")
    void reRegisterSupersedes() {
        CompletableFuture<Void> first = ackTracker.register("op-1");
        CompletableFuture<Void> second = ackTracker.register("op-1");

        ackTracker.onAck("op-1");

        assertThat(failureOf(first).getErrorCode()).isEqualTo(ErrorCode.DELIVERY_FAILED);
        assertThat(second).isCompleted();
    }

    @Test
    @DisplayName("failAll fails every pending await")
    void failAll() {
        CompletableFuture<Void> a = ackTracker.register("op-1");
        CompletableFuture<Void> b = ackTracker.register("op-2");

        int failed = ackTracker.failAll("connection lost");

        assertThat(failed).isEqualTo(2);
        assertThat(failureOf(a).getMessage()).isEqualTo("connection lost");
        assertThat(b).isCompletedExceptionally();
        assertThat(client.scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("cancel drops the await without completing it")
    void cancelLeavesFuturePending() {
        CompletableFuture<Void> await = ackTracker.register("op-1");

        ackTracker.cancel("op-1");
        client.scheduler.advanceMillis(20_000);

        assertThat(await).isNotDone();
        assertThat(ackTracker.getPendingCount()).isZero();
    }
}
