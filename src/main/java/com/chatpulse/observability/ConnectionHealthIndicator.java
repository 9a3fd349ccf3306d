package com.chatpulse.observability;

import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.connection.ConnectionStatus;
import com.chatpulse.queue.RetryQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Actuator health for the client connection, reported as the {@code connection} contributor.
 *
 * <p>READY is UP and FAILED (reconnects exhausted) is DOWN. DISCONNECTED and RECONNECTING
 * are OUT_OF_SERVICE. The states in between (connecting or authenticating) are UNKNOWN.
 */
@Component
public class ConnectionHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;
    private final RetryQueue<?> retryQueue;

    public ConnectionHealthIndicator(ConnectionManager connectionManager, RetryQueue<?> retryQueue) {
        this.connectionManager = connectionManager;
        this.retryQueue = retryQueue;
    }

    @Override
    public Health health() {
        ConnectionStatus status = connectionManager.getStatus();
        Health.Builder builder = Health.status(statusOf(status))
                .withDetail("state", status.getState())
                .withDetail("authenticated", status.isAuthenticated())
                .withDetail("authInProgress", status.isAuthInProgress())
                .withDetail("reconnectAttempts", status.getReconnectAttempts())
                .withDetail("maxReconnectAttempts", status.getMaxReconnectAttempts())
                .withDetail("queuedOperations", retryQueue.size());
        // Health details reject null values
        if (status.getSessionId() != null) {
            builder.withDetail("sessionId", status.getSessionId());
        }
        if (status.getAuthMethod() != null) {
            builder.withDetail("authMethod", status.getAuthMethod());
        }
        if (status.getConnectedAt() != null) {
            builder.withDetail("connectedAt", status.getConnectedAt().toString());
        }
        if (status.getLastPongAt() != null) {
            builder.withDetail("lastPongAt", status.getLastPongAt().toString());
        }
        return builder.build();
    }

    private static Status statusOf(ConnectionStatus status) {
        return switch (status.getState()) {
            case READY -> Status.UP;
            case FAILED -> Status.DOWN;
            case DISCONNECTED, RECONNECTING -> Status.OUT_OF_SERVICE;
            case CONNECTING, CONNECTED, AUTHENTICATING -> Status.UNKNOWN;
        };
    }
}
