package com.chatpulse.event;

import com.chatpulse.connection.ConnectionState;
import java.time.Duration;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published on each connection lifecycle milestone (connected, disconnected, reconnecting,
 * ready, reconnect exhaustion). Exactly one event is published per semantic transition.
 *
 * <p>{@code attempt} and {@code delay} are only meaningful for {@link ConnectionEventType#RECONNECTING}
 * and {@link ConnectionEventType#MAX_RECONNECT_ATTEMPTS_REACHED}; otherwise they are 0 and null.
 */
public class ConnectionEvent extends ApplicationEvent {

    private final ConnectionEventType eventType;
    private final ConnectionState previousState;
    private final ConnectionState newState;
    private final int attempt;
    private final Duration delay;
    private final String message;
    private final LocalDateTime occurredAt;

    public ConnectionEvent(
            Object source,
            ConnectionEventType eventType,
            ConnectionState previousState,
            ConnectionState newState,
            String message) {
        this(source, eventType, previousState, newState, 0, null, message);
    }

    public ConnectionEvent(
            Object source,
            ConnectionEventType eventType,
            ConnectionState previousState,
            ConnectionState newState,
            int attempt,
            Duration delay,
            String message) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.attempt = attempt;
        this.delay = delay;
        this.message = message;
        this.occurredAt = LocalDateTime.now();
    }

    public ConnectionEventType getEventType() {
        return eventType;
    }

    public ConnectionState getPreviousState() {
        return previousState;
    }

    public ConnectionState getNewState() {
        return newState;
    }

    public int getAttempt() {
        return attempt;
    }

    public Duration getDelay() {
        return delay;
    }

    public String getMessage() {
        return message;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
