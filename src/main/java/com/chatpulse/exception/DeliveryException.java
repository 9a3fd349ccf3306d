package com.chatpulse.exception;

/**
 * A single delivery attempt for a queued operation failed: the remote side answered with
 * an {@code error} envelope, the ack did not arrive, or the operation was given up on.
 */
public class DeliveryException extends ChatPulseException {

    public DeliveryException(ErrorCode errorCode, String message) {
        super(ErrorKind.CONNECTION, errorCode, message, errorCode != ErrorCode.OPERATION_CANCELLED);
    }

    public DeliveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(ErrorKind.CONNECTION, errorCode, message, true, cause);
    }
}
