package com.chatpulse.exception;

import lombok.Getter;

/**
 * Thrown (or used to fail a future) when the connection cannot be opened, is used in the
 * wrong state, or is lost. Network-classified failures are recoverable by reconnecting.
 */
@Getter
public class ConnectionException extends ChatPulseException {

    private final FailureCategory category;

    public ConnectionException(ErrorCode errorCode, String message) {
        super(ErrorKind.CONNECTION, errorCode, message, false);
        this.category = FailureCategory.UNKNOWN;
    }

    public ConnectionException(ErrorCode errorCode, String message, FailureCategory category, Throwable cause) {
        super(ErrorKind.CONNECTION, errorCode, message, category == FailureCategory.NETWORK, cause);
        this.category = category;
    }
}
