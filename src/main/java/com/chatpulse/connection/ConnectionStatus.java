package com.chatpulse.connection;

import com.chatpulse.session.AuthMethod;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the connection for callers and diagnostics. */
@Getter
@Builder
public class ConnectionStatus {

    private final ConnectionState state;
    private final String sessionId;
    private final boolean authenticated;
    private final AuthMethod authMethod;
    private final Instant connectedAt;
    private final Instant lastPongAt;
    private final int reconnectAttempts;
    private final int maxReconnectAttempts;
    private final boolean authInProgress;

    public boolean isReady() {
        return state == ConnectionState.READY;
    }
}
