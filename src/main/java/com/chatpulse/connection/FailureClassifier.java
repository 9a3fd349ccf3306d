package com.chatpulse.connection;

import com.chatpulse.exception.AuthenticationException;
import com.chatpulse.exception.ClientTimeoutException;
import com.chatpulse.exception.ConnectionException;
import com.chatpulse.exception.FailureCategory;
import com.chatpulse.exception.RateLimitException;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Tags connection failures so the manager can decide whether the stored session survives.
 *
 * <p>Exceptions are classified by type and then by message text, walking the cause chain
 * (so wrapped {@code CompletionException}s classify by their cause).
 * Close frames are classified by code, then by reason text.
 */
public class FailureClassifier {

    /** Application close codes used by the service. */
    static final int CLOSE_UNAUTHORIZED = 4001;

    static final int CLOSE_FORBIDDEN = 4003;
    static final int CLOSE_RATE_LIMITED = 4029;

    public FailureCategory classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof ConnectionException connectionException
                    && connectionException.getCategory() != FailureCategory.UNKNOWN) {
                return connectionException.getCategory();
            }
            if (current instanceof AuthenticationException) {
                return FailureCategory.AUTH;
            }
            if (current instanceof RateLimitException) {
                return FailureCategory.RATE_LIMITED;
            }
            if (current instanceof IOException
                    || current instanceof TimeoutException
                    || current instanceof ClientTimeoutException) {
                return FailureCategory.NETWORK;
            }
            FailureCategory byMessage = classifyText(current.getMessage());
            if (byMessage != FailureCategory.UNKNOWN) {
                return byMessage;
            }
            current = current.getCause();
        }
        return FailureCategory.UNKNOWN;
    }

    public FailureCategory classify(int closeCode, String reason) {
        switch (closeCode) {
            case CLOSE_UNAUTHORIZED, CLOSE_FORBIDDEN:
                return FailureCategory.AUTH;
            case CLOSE_RATE_LIMITED:
                return FailureCategory.RATE_LIMITED;
            case 1011, 1012, 1013:
                return FailureCategory.SERVER;
            case 1001, 1006:
                return FailureCategory.NETWORK;
            default:
                FailureCategory byReason = classifyText(reason);
                return byReason != FailureCategory.UNKNOWN || closeCode == 1000 ? byReason : FailureCategory.NETWORK;
        }
    }

    private FailureCategory classifyText(String text) {
        if (text == null || text.isBlank()) {
            return FailureCategory.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("unauthorized")
                || lower.contains("forbidden")
                || lower.contains("auth")
                || lower.contains("401")
                || lower.contains("403")) {
            return FailureCategory.AUTH;
        }
        if (lower.contains("rate limit") || lower.contains("too many requests") || lower.contains("429")) {
            return FailureCategory.RATE_LIMITED;
        }
        if (lower.contains("internal server error")
                || lower.contains("server error")
                || lower.contains("service unavailable")
                || lower.contains("502")
                || lower.contains("503")) {
            return FailureCategory.SERVER;
        }
        if (lower.contains("econnrefused")
                || lower.contains("econnreset")
                || lower.contains("enetunreach")
                || lower.contains("connection")
                || lower.contains("network")
                || lower.contains("timed out")
                || lower.contains("timeout")) {
            return FailureCategory.NETWORK;
        }
        return FailureCategory.UNKNOWN;
    }
}
