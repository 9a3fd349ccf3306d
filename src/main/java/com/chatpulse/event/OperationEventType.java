package com.chatpulse.event;

public enum OperationEventType {
    QUEUED,
    DELIVERED,
    RETRY_SCHEDULED,
    FAILED,
    CANCELLED
}
