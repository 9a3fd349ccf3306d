package com.chatpulse.event;

import java.time.Duration;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Per-operation delivery progress from the retry queue. {@code FAILED} is terminal for that
 * operation only; the rest of the queue keeps draining.
 */
public class OperationEvent extends ApplicationEvent {

    private final OperationEventType eventType;
    private final String operationId;
    private final int priority;
    private final int attempts;
    private final Duration retryDelay;
    private final String errorMessage;
    private final LocalDateTime occurredAt;

    public OperationEvent(
            Object source,
            OperationEventType eventType,
            String operationId,
            int priority,
            int attempts,
            Duration retryDelay,
            String errorMessage) {
        super(source);
        this.eventType = eventType;
        this.operationId = operationId;
        this.priority = priority;
        this.attempts = attempts;
        this.retryDelay = retryDelay;
        this.errorMessage = errorMessage;
        this.occurredAt = LocalDateTime.now();
    }

    public OperationEventType getEventType() {
        return eventType;
    }

    public String getOperationId() {
        return operationId;
    }

    public int getPriority() {
        return priority;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
