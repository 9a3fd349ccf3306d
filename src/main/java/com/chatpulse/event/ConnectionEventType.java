package com.chatpulse.event;

public enum ConnectionEventType {
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    READY,
    MAX_RECONNECT_ATTEMPTS_REACHED
}
