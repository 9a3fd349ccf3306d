package com.chatpulse.exception;

/** The transport rejected a send or reported an I/O failure. */
public class TransportException extends ChatPulseException {

    public TransportException(String message) {
        super(ErrorKind.CONNECTION, ErrorCode.TRANSPORT_ERROR, message, true);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, ErrorCode.TRANSPORT_ERROR, message, true, cause);
    }
}
