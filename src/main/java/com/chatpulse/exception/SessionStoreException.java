package com.chatpulse.exception;

public class SessionStoreException extends ChatPulseException {

    public SessionStoreException(String message) {
        this(message, null);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, ErrorCode.SESSION_STORE_ERROR, message, false, cause);
    }
}
