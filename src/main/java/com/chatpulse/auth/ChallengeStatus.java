package com.chatpulse.auth;

/**
 * AuthChallenge lifecycle. PENDING is the only non-terminal status.
 *
 * <pre>
 * PENDING ──verify ok──> VERIFIED
 *    │ ──expiry──────> EXPIRED
 *    └──cancel───────> CANCELLED
 * </pre>
 */
public enum ChallengeStatus {
    PENDING,
    VERIFIED,
    EXPIRED,
    CANCELLED
}
