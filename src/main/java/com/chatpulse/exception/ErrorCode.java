package com.chatpulse.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // Connection lifecycle
    INVALID_STATE("INVALID_STATE"),
    NOT_CONNECTED("NOT_CONNECTED"),
    NOT_READY("NOT_READY"),
    CONNECT_FAILED("CONNECT_FAILED"),
    CONNECT_TIMEOUT("CONNECT_TIMEOUT"),
    CONNECTION_LOST("CONNECTION_LOST"),
    HEARTBEAT_TIMEOUT("HEARTBEAT_TIMEOUT"),
    RECONNECT_EXHAUSTED("RECONNECT_EXHAUSTED"),
    TRANSPORT_ERROR("TRANSPORT_ERROR"),

    // Authentication
    AUTH_TIMEOUT("AUTH_TIMEOUT"),
    AUTH_CANCELLED("AUTH_CANCELLED"),
    AUTH_REJECTED("AUTH_REJECTED"),
    CHALLENGE_EXPIRED("CHALLENGE_EXPIRED"),
    CHALLENGE_NOT_PENDING("CHALLENGE_NOT_PENDING"),
    INVALID_CODE("INVALID_CODE"),
    MAX_ATTEMPTS_EXCEEDED("MAX_ATTEMPTS_EXCEEDED"),
    SESSION_INVALID("SESSION_INVALID"),
    SESSION_STORE_ERROR("SESSION_STORE_ERROR"),

    // Delivery pipeline
    RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED"),
    QUEUE_FULL("QUEUE_FULL"),
    DELIVERY_FAILED("DELIVERY_FAILED"),
    ACK_TIMEOUT("ACK_TIMEOUT"),
    OPERATION_CANCELLED("OPERATION_CANCELLED"),

    // Input validation
    INVALID_PHONE_NUMBER("INVALID_PHONE_NUMBER"),
    INVALID_PRIORITY("INVALID_PRIORITY"),
    INVALID_ARGUMENT("INVALID_ARGUMENT");

    private final String code;
}
