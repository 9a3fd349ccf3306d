package com.chatpulse.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the client's unchecked exception hierarchy.
 *
 * <p>Every failure carries an {@link ErrorKind} (what broke), an {@link ErrorCode}
 * (why) and a {@code recoverable} flag telling the caller whether waiting or retrying
 * can help. The same triple is copied onto published error events.
 */
@Getter
public abstract class ChatPulseException extends RuntimeException {

    private final ErrorKind kind;
    private final ErrorCode errorCode;
    private final boolean recoverable;
    private final Map<String, Object> details;

    protected ChatPulseException(ErrorKind kind, ErrorCode errorCode, String message, boolean recoverable) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
        this.recoverable = recoverable;
        this.details = Map.of();
    }

    protected ChatPulseException(
            ErrorKind kind, ErrorCode errorCode, String message, boolean recoverable, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
        this.recoverable = recoverable;
        this.details = details != null ? details : Map.of();
    }

    protected ChatPulseException(
            ErrorKind kind, ErrorCode errorCode, String message, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
        this.recoverable = recoverable;
        this.details = Map.of();
    }
}
