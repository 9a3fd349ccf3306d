package com.chatpulse.auth;

/** Flow started automatically after the transport opens when no session can be restored. */
public enum AuthStrategy {
    QR,
    PAIRING,
    /**
     * Pairing when a phone number is configured, otherwise QR. A pairing flow that fails or
     * cannot start falls back to QR on the same connection.
     */
    AUTO,
    /** Wait for an explicit authenticateWithQR / authenticateWithPairing call. */
    MANUAL
}
