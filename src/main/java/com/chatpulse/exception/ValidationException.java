package com.chatpulse.exception;

public class ValidationException extends ChatPulseException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(ErrorKind.VALIDATION, errorCode, message, false);
    }
}
