package com.chatpulse.auth;

public enum ChallengeKind {
    QR,
    PAIRING
}
