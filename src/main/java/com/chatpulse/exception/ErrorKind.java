package com.chatpulse.exception;

/**
 * Top-level error category surfaced on every {@link ChatPulseException} and on
 * {@link com.chatpulse.event.ClientErrorEvent}s.
 */
public enum ErrorKind {
    CONNECTION,
    AUTHENTICATION,
    RATE_LIMIT,
    QUEUE_FULL,
    VALIDATION,
    TIMEOUT
}
