package com.chatpulse.queue;

public enum OperationStatus {
    PENDING,
    IN_FLIGHT,
    FAILED,
    DONE
}
