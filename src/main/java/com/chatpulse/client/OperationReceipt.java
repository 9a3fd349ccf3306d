package com.chatpulse.client;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Handle returned when an operation is accepted into the queue. {@code completion} completes
 * on delivery and fails once the queue gives up on the operation or it is cancelled.
 */
@Getter
@RequiredArgsConstructor
public class OperationReceipt {

    private final String operationId;
    private final int priority;
    private final Instant scheduledAt;
    private final CompletableFuture<Void> completion;
}
