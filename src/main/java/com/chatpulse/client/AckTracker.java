package com.chatpulse.client;

import com.chatpulse.config.ClientContext;
import com.chatpulse.exception.ClientTimeoutException;
import com.chatpulse.exception.DeliveryException;
import com.chatpulse.exception.ErrorCode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates sent operations with the server's {@code ack} / {@code error} envelopes.
 *
 * <p>Register before sending so an ack that races the send is never lost. Each await
 * auto-expires after the ack timeout, failing its future with {@code ACK_TIMEOUT}; the retry
 * queue then counts the attempt as failed.
 */
public class AckTracker {

    private static final Logger log = LoggerFactory.getLogger(AckTracker.class);

    private final ClientContext context;
    private final Duration ackTimeout;
    private final ConcurrentHashMap<String, PendingAck> pending = new ConcurrentHashMap<>();

    public AckTracker(ClientContext context) {
        this.context = context;
        this.ackTimeout = Duration.ofMillis(context.getProperties().getQueue().getAckTimeoutMs());
    }

    /** Registers an await for {@code ref}, replacing any earlier one for the same ref. */
    public CompletableFuture<Void> register(String ref) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> expiry =
                context.getScheduler().schedule(() -> expire(ref, future), context.now().plus(ackTimeout));
        PendingAck previous = pending.put(ref, new PendingAck(future, expiry));
        if (previous != null) {
            previous.expiry().cancel(false);
            previous.future().completeExceptionally(
                    new DeliveryException(ErrorCode.DELIVERY_FAILED, "Superseded by a newer attempt for " + ref));
        }
        return future;
    }

    public void onAck(String ref) {
        PendingAck ack = ref != null ? pending.remove(ref) : null;
        if (ack == null) {
            log.debug("Ack for unknown or expired ref {}", ref);
            return;
        }
        ack.expiry().cancel(false);
        ack.future().complete(null);
    }

    /** @return true if the error matched a pending await */
    public boolean onError(String ref, String code, String message) {
        PendingAck ack = ref != null ? pending.remove(ref) : null;
        if (ack == null) {
            return false;
        }
        ack.expiry().cancel(false);
        ack.future().completeExceptionally(new DeliveryException(
                ErrorCode.DELIVERY_FAILED, "Server rejected " + ref + " (" + code + "): " + message));
        return true;
    }

    /** Drops an await without completing it, e.g. when the send itself failed. */
    public void cancel(String ref) {
        PendingAck ack = pending.remove(ref);
        if (ack != null) {
            ack.expiry().cancel(false);
        }
    }

    /** Fails every pending await; used when the connection drops. */
    public int failAll(String reason) {
        List<PendingAck> drained = new ArrayList<>();
        for (String ref : new ArrayList<>(pending.keySet())) {
            PendingAck ack = pending.remove(ref);
            if (ack != null) {
                drained.add(ack);
            }
        }
        for (PendingAck ack : drained) {
            ack.expiry().cancel(false);
            ack.future().completeExceptionally(new DeliveryException(ErrorCode.DELIVERY_FAILED, reason));
        }
        if (!drained.isEmpty()) {
            log.info("Failed {} pending acks: {}", drained.size(), reason);
        }
        return drained.size();
    }

    public int getPendingCount() {
        return pending.size();
    }

    private void expire(String ref, CompletableFuture<Void> future) {
        PendingAck current = pending.get(ref);
        if (current == null || current.future() != future || !pending.remove(ref, current)) {
            return;
        }
        log.warn("No ack for {} within {}ms", ref, ackTimeout.toMillis());
        future.completeExceptionally(new ClientTimeoutException(
                ErrorCode.ACK_TIMEOUT, "No ack for " + ref + " within " + ackTimeout.toMillis() + "ms"));
    }

    private record PendingAck(CompletableFuture<Void> future, ScheduledFuture<?> expiry) {}
}
