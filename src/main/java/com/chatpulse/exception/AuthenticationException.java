package com.chatpulse.exception;

public class AuthenticationException extends ChatPulseException {

    public AuthenticationException(ErrorCode errorCode, String message) {
        super(ErrorKind.AUTHENTICATION, errorCode, message, errorCode == ErrorCode.INVALID_CODE);
    }

    public AuthenticationException(ErrorCode errorCode, String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, errorCode, message, false, cause);
    }
}
