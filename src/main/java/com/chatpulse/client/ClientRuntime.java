package com.chatpulse.client;

import com.chatpulse.config.ClientContext;
import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.connection.ConnectionState;
import com.chatpulse.connection.ConnectionStatus;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ErrorKind;
import com.chatpulse.exception.FailureCategory;
import com.chatpulse.exception.ValidationException;
import com.chatpulse.queue.QueueStats;
import com.chatpulse.queue.QueuedOperation;
import com.chatpulse.queue.RetryQueue;
import com.chatpulse.ratelimit.RateLimiter;
import com.chatpulse.session.Session;
import com.chatpulse.transport.Envelope;
import com.chatpulse.transport.EnvelopeTypes;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Public entry point of the client.
 *
 * <p>Outbound: {@link #enqueueOperation} runs admission ({@link RateLimiter}) and then hands the
 * operation to the {@link RetryQueue}, which delivers it through the {@link ConnectionManager}
 * once the connection is READY. The queue is paused on every transition away from READY and
 * resumed on READY; pending acks fail when READY is lost.
 *
 * <p>Inbound: {@code ack} and {@code error} envelopes settle deliveries; everything else is
 * re-published to the application as an {@link com.chatpulse.event.InboundMessageEvent}.
 *
 * <p>As a {@link SmartLifecycle} bean it starts the rate-limiter sweep with the context and
 * disconnects and drains on shutdown.
 */
public class ClientRuntime implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ClientRuntime.class);

    private final ClientContext context;
    private final ConnectionManager connectionManager;
    private final RateLimiter rateLimiter;
    private final RetryQueue<OutboundOperation> retryQueue;
    private final AckTracker ackTracker;

    private volatile boolean running;

    public ClientRuntime(
            ClientContext context,
            ConnectionManager connectionManager,
            RateLimiter rateLimiter,
            RetryQueue<OutboundOperation> retryQueue,
            AckTracker ackTracker) {
        this.context = context;
        this.connectionManager = connectionManager;
        this.rateLimiter = rateLimiter;
        this.retryQueue = retryQueue;
        this.ackTracker = ackTracker;
        retryQueue.setDispatcher(new OperationSender(context, connectionManager, ackTracker));
        connectionManager.addStateListener(this::onConnectionStateChanged);
        connectionManager.addInboundListener(this::onInbound);
    }

    // ---- Connection ----

    public CompletableFuture<Void> connect() {
        return connectionManager.connect();
    }

    public void disconnect() {
        connectionManager.disconnect();
    }

    public void logout() {
        connectionManager.logout();
    }

    public CompletableFuture<Session> authenticateWithQR() {
        return connectionManager.authenticateWithQR();
    }

    public CompletableFuture<Session> authenticateWithPairing(String phoneNumber) {
        return connectionManager.authenticateWithPairing(phoneNumber);
    }

    public ConnectionStatus getConnectionStatus() {
        return connectionManager.getStatus();
    }

    // ---- Operations ----

    public OperationReceipt enqueueOperation(OutboundOperation operation, int priority) {
        return enqueueOperation(operation, priority, null);
    }

    /**
     * Admits and queues one operation.
     *
     * @param scheduledAt earliest delivery time, or null for as soon as possible
     * @throws ValidationException for a missing target/action or a priority outside 1..5
     * @throws com.chatpulse.exception.RateLimitException when admission is refused
     * @throws com.chatpulse.exception.QueueFullException when the queue is at capacity
     */
    public OperationReceipt enqueueOperation(OutboundOperation operation, int priority, Instant scheduledAt) {
        validate(operation, priority);
        rateLimiter.checkLimit(operation.getTarget(), operation.getAction());
        QueuedOperation<OutboundOperation> queued = retryQueue.enqueue(operation, priority, scheduledAt);
        return new OperationReceipt(queued.getId(), queued.getPriority(), queued.getScheduledAt(), queued.getCompletion());
    }

    public boolean cancelOperation(String operationId) {
        return retryQueue.cancel(operationId);
    }

    public QueueStats getQueueStats() {
        return retryQueue.getStats();
    }

    public RateLimitUsage getRateLimitUsage(String identifier, String action) {
        return RateLimitUsage.builder()
                .identifier(identifier)
                .action(action)
                .used(rateLimiter.getUsage(identifier, action))
                .remaining(rateLimiter.getRemaining(identifier, action))
                .build();
    }

    // ---- Wiring ----

    private void onConnectionStateChanged(ConnectionState previous, ConnectionState current) {
        if (current == ConnectionState.READY) {
            retryQueue.resume();
            return;
        }
        retryQueue.pause();
        if (previous == ConnectionState.READY) {
            ackTracker.failAll("Connection left READY (" + current + ")");
        }
    }

    private void onInbound(Envelope envelope) {
        switch (envelope.getType()) {
            case EnvelopeTypes.ACK -> ackTracker.onAck(envelope.dataString("ref"));
            case EnvelopeTypes.ERROR -> onErrorEnvelope(envelope);
            default -> context.getEvents().publishInbound(this, envelope);
        }
    }

    private void onErrorEnvelope(Envelope envelope) {
        String ref = envelope.dataString("ref");
        String code = envelope.dataString("code");
        String message = envelope.dataString("message");
        if (ackTracker.onError(ref, code, message)) {
            return;
        }
        log.warn("Server error (code={}): {}", code, message);
        context.getEvents()
                .publishError(
                        this,
                        ErrorKind.CONNECTION,
                        ErrorCode.TRANSPORT_ERROR,
                        FailureCategory.SERVER,
                        message != null ? message : "Server error " + code,
                        true);
    }

    private static void validate(OutboundOperation operation, int priority) {
        if (operation == null) {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Operation is required");
        }
        if (operation.getTarget() == null || operation.getTarget().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Operation target is required");
        }
        if (operation.getAction() == null || operation.getAction().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "Operation action is required");
        }
        if (priority < RetryQueue.HIGHEST_PRIORITY || priority > RetryQueue.LOWEST_PRIORITY) {
            throw new ValidationException(
                    ErrorCode.INVALID_PRIORITY,
                    "Priority must be between " + RetryQueue.HIGHEST_PRIORITY + " and " + RetryQueue.LOWEST_PRIORITY
                            + ", got " + priority);
        }
    }

    // ---- SmartLifecycle ----

    @Override
    public void start() {
        rateLimiter.startCleanup();
        running = true;
        log.info("ChatPulse client runtime started");
    }

    @Override
    public void stop() {
        running = false;
        connectionManager.disconnect();
        retryQueue.shutdown();
        rateLimiter.stop();
        log.info("ChatPulse client runtime stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 200;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
