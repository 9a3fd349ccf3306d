package com.chatpulse.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers one operation. The returned future completes when the remote side has accepted
 * it and fails when this attempt should count as failed. Implementations must not block.
 */
@FunctionalInterface
public interface OperationDispatcher<T> {

    CompletableFuture<Void> dispatch(QueuedOperation<T> operation);
}
