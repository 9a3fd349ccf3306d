package com.chatpulse.session;

public enum AuthMethod {
    QR,
    PAIRING,
    RESTORE
}
