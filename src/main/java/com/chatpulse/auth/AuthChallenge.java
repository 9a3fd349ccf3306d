package com.chatpulse.auth;

import com.chatpulse.exception.AuthenticationException;
import com.chatpulse.exception.ErrorCode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;

/**
 * One QR or pairing challenge. Owned by {@link AuthFlow}, which serializes access to it.
 *
 * <p>Verification order matters: a challenge past {@code expiresAt} fails as expired even
 * when the code is right, and once {@code attempts == maxAttempts} every further verify
 * fails without being counted, so {@code attempts <= maxAttempts} always holds. Only wrong
 * codes are counted.
 */
@Getter
public class AuthChallenge {

    private final String id;
    private final ChallengeKind kind;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final int maxAttempts;

    private String payload;
    private int attempts;
    private ChallengeStatus status = ChallengeStatus.PENDING;

    public AuthChallenge(ChallengeKind kind, String payload, Instant issuedAt, Instant expiresAt, int maxAttempts) {
        this.id = UUID.randomUUID().toString();
        this.kind = kind;
        this.payload = payload;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.maxAttempts = maxAttempts;
    }

    public boolean isPending() {
        return status == ChallengeStatus.PENDING;
    }

    /** Replaces the payload (QR refresh or pairing code arrival). Ignored once the challenge is settled. */
    public void updatePayload(String newPayload) {
        if (isPending()) {
            this.payload = newPayload;
        }
    }

    /**
     * Checks a response against the current payload.
     *
     * @throws AuthenticationException with CHALLENGE_NOT_PENDING, CHALLENGE_EXPIRED,
     *         MAX_ATTEMPTS_EXCEEDED or INVALID_CODE
     */
    public void verify(String response, Instant now) {
        if (status != ChallengeStatus.PENDING) {
            throw new AuthenticationException(
                    ErrorCode.CHALLENGE_NOT_PENDING, "Challenge " + id + " is " + status);
        }
        if (now.isAfter(expiresAt)) {
            status = ChallengeStatus.EXPIRED;
            throw new AuthenticationException(ErrorCode.CHALLENGE_EXPIRED, "Challenge " + id + " expired");
        }
        if (attempts >= maxAttempts) {
            throw new AuthenticationException(
                    ErrorCode.MAX_ATTEMPTS_EXCEEDED, "Maximum verification attempts (" + maxAttempts + ") exceeded");
        }
        if (!Objects.equals(payload, response)) {
            attempts++;
            throw new AuthenticationException(
                    ErrorCode.INVALID_CODE,
                    "Invalid code, " + (maxAttempts - attempts) + " attempt(s) remaining");
        }
        status = ChallengeStatus.VERIFIED;
    }

    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    void expire() {
        if (isPending()) {
            status = ChallengeStatus.EXPIRED;
        }
    }

    void cancel() {
        if (isPending()) {
            status = ChallengeStatus.CANCELLED;
        }
    }
}
