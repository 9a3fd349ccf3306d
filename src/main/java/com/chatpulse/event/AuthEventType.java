package com.chatpulse.event;

public enum AuthEventType {
    /** A QR challenge payload was issued or refreshed. */
    QR_GENERATED,
    /** A pairing code was issued for the requested phone number. */
    PAIRING_CODE,
    /** A session was accepted by the remote side (any method, including restore). */
    AUTHENTICATED
}
