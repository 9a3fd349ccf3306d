package com.chatpulse.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * Admission rejected by the rate limiter. Never retried internally: the caller is
 * expected to wait at least {@link #getRetryAfter()} before trying again.
 */
@Getter
public class RateLimitException extends ChatPulseException {

    private final Duration retryAfter;
    private final String window;

    public RateLimitException(String key, String window, long limit, Duration retryAfter) {
        super(
                ErrorKind.RATE_LIMIT,
                ErrorCode.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded for " + key + ": " + limit + " per " + window + ", retry after "
                        + retryAfter.toMillis() + "ms",
                true,
                Map.of("key", key, "window", window, "limit", limit, "retryAfterMs", retryAfter.toMillis()));
        this.retryAfter = retryAfter;
        this.window = window;
    }
}
