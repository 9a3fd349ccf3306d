package com.chatpulse.exception;

import java.util.Map;

public class QueueFullException extends ChatPulseException {

    public QueueFullException(int maxSize) {
        super(
                ErrorKind.QUEUE_FULL,
                ErrorCode.QUEUE_FULL,
                "Queue is full (maxSize=" + maxSize + ")",
                false,
                Map.of("maxSize", maxSize));
    }
}
