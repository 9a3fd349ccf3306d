package com.chatpulse.connection;

import java.time.Duration;

/** Exponential backoff: {@code min(baseDelay * 2^attempt, maxDelay)}, attempt counted from 0. */
public class ReconnectPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;

    public ReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    public Duration delayFor(int attempt) {
        if (attempt >= 62 || baseDelayMs > (maxDelayMs >> attempt)) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis(Math.min(baseDelayMs << attempt, maxDelayMs));
    }

    public boolean isExhausted(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
