package com.chatpulse.event;

import com.chatpulse.connection.ConnectionState;
import com.chatpulse.exception.ChatPulseException;
import com.chatpulse.exception.ConnectionException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ErrorKind;
import com.chatpulse.exception.FailureCategory;
import com.chatpulse.session.AuthMethod;
import com.chatpulse.transport.Envelope;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed publishing entry point for every client event, wrapping Spring's
 * {@link ApplicationEventPublisher}.
 *
 * <p>Components never construct events themselves; they call the method matching the
 * semantic transition. Listener exceptions are caught and logged here so a broken
 * subscriber cannot unwind a timer or transport callback that is mid-transition.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Connection ----

    public void publishConnected(Object source, ConnectionState previous, ConnectionState current) {
        publish(new ConnectionEvent(source, ConnectionEventType.CONNECTED, previous, current, "Transport open"));
    }

    public void publishDisconnected(Object source, ConnectionState previous, String reason) {
        publish(new ConnectionEvent(
                source, ConnectionEventType.DISCONNECTED, previous, ConnectionState.DISCONNECTED, reason));
    }

    public void publishReconnecting(Object source, int attempt, Duration delay) {
        publish(new ConnectionEvent(
                source,
                ConnectionEventType.RECONNECTING,
                ConnectionState.DISCONNECTED,
                ConnectionState.RECONNECTING,
                attempt,
                delay,
                "Reconnect attempt " + attempt + " in " + delay.toMillis() + "ms"));
    }

    public void publishReady(Object source, ConnectionState previous) {
        publish(new ConnectionEvent(source, ConnectionEventType.READY, previous, ConnectionState.READY, "Ready"));
    }

    public void publishMaxReconnectAttemptsReached(Object source, int attempts) {
        publish(new ConnectionEvent(
                source,
                ConnectionEventType.MAX_RECONNECT_ATTEMPTS_REACHED,
                ConnectionState.RECONNECTING,
                ConnectionState.FAILED,
                attempts,
                null,
                "Gave up after " + attempts + " reconnect attempts"));
    }

    // ---- Auth ----

    public void publishQrGenerated(Object source, String payload, Instant expiresAt) {
        publish(new AuthEvent(source, AuthEventType.QR_GENERATED, payload, expiresAt, AuthMethod.QR, null));
    }

    public void publishPairingCode(Object source, String code, Instant expiresAt) {
        publish(new AuthEvent(source, AuthEventType.PAIRING_CODE, code, expiresAt, AuthMethod.PAIRING, null));
    }

    public void publishAuthenticated(Object source, AuthMethod method, String sessionId) {
        publish(new AuthEvent(source, AuthEventType.AUTHENTICATED, null, null, method, sessionId));
    }

    // ---- Errors ----

    public void publishError(Object source, ChatPulseException exception) {
        FailureCategory category =
                exception instanceof ConnectionException ce ? ce.getCategory() : null;
        publish(new ClientErrorEvent(
                source,
                exception.getKind(),
                exception.getErrorCode(),
                category,
                exception.getMessage(),
                exception.isRecoverable()));
    }

    public void publishError(
            Object source,
            ErrorKind kind,
            ErrorCode errorCode,
            FailureCategory category,
            String message,
            boolean recoverable) {
        publish(new ClientErrorEvent(source, kind, errorCode, category, message, recoverable));
    }

    // ---- Operations ----

    public void publishOperation(
            Object source,
            OperationEventType eventType,
            String operationId,
            int priority,
            int attempts,
            Duration retryDelay,
            String errorMessage) {
        publish(new OperationEvent(source, eventType, operationId, priority, attempts, retryDelay, errorMessage));
    }

    // ---- Inbound ----

    public void publishInbound(Object source, Envelope envelope) {
        publish(new InboundMessageEvent(source, envelope));
    }

    private void publish(Object event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
