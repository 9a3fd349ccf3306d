package com.chatpulse.event;

import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ErrorKind;
import com.chatpulse.exception.FailureCategory;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Error surfaced from a timer or transport callback, where there is no caller to throw to.
 * Failures of direct calls are thrown instead and never published here.
 */
public class ClientErrorEvent extends ApplicationEvent {

    private final ErrorKind kind;
    private final ErrorCode errorCode;
    private final FailureCategory category;
    private final String message;
    private final boolean recoverable;
    private final LocalDateTime occurredAt;

    public ClientErrorEvent(
            Object source,
            ErrorKind kind,
            ErrorCode errorCode,
            FailureCategory category,
            String message,
            boolean recoverable) {
        super(source);
        this.kind = kind;
        this.errorCode = errorCode;
        this.category = category;
        this.message = message;
        this.recoverable = recoverable;
        this.occurredAt = LocalDateTime.now();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public FailureCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
