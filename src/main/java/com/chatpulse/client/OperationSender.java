package com.chatpulse.client;

import com.chatpulse.config.ClientContext;
import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.exception.ChatPulseException;
import com.chatpulse.queue.OperationDispatcher;
import com.chatpulse.queue.QueuedOperation;
import com.chatpulse.transport.Envelope;
import com.chatpulse.transport.EnvelopeTypes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts queued operations on the wire as {@code operation} envelopes. The envelope id is the
 * operation id, which is what the server echoes back as {@code ref} in its ack or error.
 */
public class OperationSender implements OperationDispatcher<OutboundOperation> {

    private static final Logger log = LoggerFactory.getLogger(OperationSender.class);

    private final ClientContext context;
    private final ConnectionManager connectionManager;
    private final AckTracker ackTracker;
    private final boolean requireAck;

    public OperationSender(ClientContext context, ConnectionManager connectionManager, AckTracker ackTracker) {
        this.context = context;
        this.connectionManager = connectionManager;
        this.ackTracker = ackTracker;
        this.requireAck = context.getProperties().getQueue().isRequireAck();
    }

    @Override
    public CompletableFuture<Void> dispatch(QueuedOperation<OutboundOperation> operation) {
        OutboundOperation payload = operation.getPayload();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("target", payload.getTarget());
        data.put("action", payload.getAction());
        data.put("body", payload.getBody() != null ? payload.getBody() : Map.of());
        data.put("attempt", operation.getAttempts() + 1);
        Envelope envelope = new Envelope(EnvelopeTypes.OPERATION, data, operation.getId(), context.nowMillis());

        CompletableFuture<Void> ack = requireAck ? ackTracker.register(operation.getId()) : null;
        try {
            connectionManager.send(envelope);
        } catch (ChatPulseException e) {
            if (ack != null) {
                ackTracker.cancel(operation.getId());
            }
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Sent operation {} ({} -> {})", operation.getId(), payload.getAction(), payload.getTarget());
        return ack != null ? ack : CompletableFuture.completedFuture(null);
    }
}
