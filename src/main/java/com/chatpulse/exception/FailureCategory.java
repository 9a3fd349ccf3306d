package com.chatpulse.exception;

/**
 * Classification of a connection-level failure, used to decide whether the stored
 * session survives the failure. Only {@link #AUTH} invalidates it.
 */
public enum FailureCategory {
    NETWORK,
    AUTH,
    RATE_LIMITED,
    SERVER,
    UNKNOWN
}
