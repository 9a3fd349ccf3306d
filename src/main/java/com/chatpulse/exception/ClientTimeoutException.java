package com.chatpulse.exception;

/** A bounded wait (connect, restore round trip, ack) did not complete in time. */
public class ClientTimeoutException extends ChatPulseException {

    public ClientTimeoutException(ErrorCode errorCode, String message) {
        super(ErrorKind.TIMEOUT, errorCode, message, true);
    }
}
