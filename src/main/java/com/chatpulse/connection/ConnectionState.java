package com.chatpulse.connection;

/**
 * Connection lifecycle owned by {@link ConnectionManager}.
 *
 * <pre>
 * DISCONNECTED ──connect()──> CONNECTING ──open──> CONNECTED ──challenge flow──> AUTHENTICATING
 *                                                     │                               │
 *                                                     └──restore ok──> READY <──ok────┘
 *
 * CONNECTED / AUTHENTICATING / READY ──lost──> DISCONNECTED ──(auto-reconnect)──> RECONNECTING
 * RECONNECTING ──open──> CONNECTED
 * RECONNECTING ──attempts exhausted──> FAILED ──disconnect()──> DISCONNECTED
 * </pre>
 *
 * <p>READY is the only state in which operations are sent.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    AUTHENTICATING,
    READY,
    RECONNECTING,
    FAILED;

    /** States in which the transport is open and the heartbeat runs. */
    public boolean isLive() {
        return this == CONNECTED || this == AUTHENTICATING || this == READY;
    }
}
