package com.chatpulse.connection;

/** Synchronous state-change hook for components wired to the connection manager. */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChanged(ConnectionState previous, ConnectionState current);
}
