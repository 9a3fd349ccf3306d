package com.chatpulse.config;

import com.chatpulse.auth.AuthStrategy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Client configuration bound to the {@code chatpulse.*} prefix.
 *
 * <p>Top-level fields cover the session, authentication and connection lifecycle;
 * nested groups cover the wire transport, the rate limiter and the retry queue.
 * All durations are milliseconds.
 */
@ConfigurationProperties(prefix = "chatpulse")
@Getter
@Setter
public class ChatPulseProperties {

    /** Key under which the authenticated session is persisted. */
    private String sessionName = "default";

    /** Directory for the file-backed session store. */
    private String sessionDir = "./sessions";

    /** Try a stored session before starting a fresh challenge. */
    private boolean restoreSession = true;

    /** Flow started automatically once the transport is open and no session could be restored. */
    private AuthStrategy authStrategy = AuthStrategy.QR;

    /** Phone number used when {@code authStrategy} is PAIRING or AUTO. */
    private String pairingPhoneNumber;

    /** Lifetime of a QR or pairing challenge. */
    private long authTimeoutMs = 120_000;

    private long qrRefreshIntervalMs = 30_000;

    /** Upper bound on the session-restore round trip. */
    private long restoreTimeoutMs = 15_000;

    private int challengeMaxAttempts = 3;

    /** Session lifetime used when the server does not send an explicit expiry. */
    private long sessionTtlMs = Duration.ofDays(30).toMillis();

    private long connectTimeoutMs = 30_000;

    private long heartbeatIntervalMs = 30_000;

    /** Intervals without a pong before the connection is declared stale. */
    private int heartbeatMissedThreshold = 2;

    private boolean autoReconnect = true;

    private long reconnectBaseDelayMs = 1_000;

    private long reconnectMaxDelayMs = 60_000;

    private int maxReconnectAttempts = 10;

    /** Open the connection as soon as the application context is ready. */
    private boolean connectOnStartup = false;

    private Transport transport = new Transport();

    private RateLimits rateLimits = new RateLimits();

    private Queue queue = new Queue();

    @Getter
    @Setter
    public static class Transport {

        /** WebSocket endpoint of the messaging service. */
        private String url = "ws://localhost:8080/ws";

        /** Extra handshake headers (user agent, client version). */
        private Map<String, String> headers = new LinkedHashMap<>();

        /** Per-send time limit enforced by the session decorator. */
        private int sendTimeLimitMs = 10_000;

        private int sendBufferSizeLimit = 512 * 1024;
    }

    /** Caps of 0 or less disable the corresponding window. */
    @Getter
    @Setter
    public static class RateLimits {

        private boolean enabled = true;

        /** Calls allowed per second. */
        private int burst = 10;

        private int perMinute = 60;

        private int perHour = 1_000;

        private int perDay = 10_000;

        private long cleanupIntervalMs = 300_000;
    }

    @Getter
    @Setter
    public static class Queue {

        /** Operations owned by the queue at once (queued, in flight and awaiting retry). */
        private int maxSize = 1_000;

        /** Delivery attempts per operation, including the first. */
        private int maxRetries = 3;

        private long retryDelayMs = 1_000;

        /** Operations dispatched per tick. */
        private int batchSize = 5;

        private long processingIntervalMs = 100;

        /** Wait for an {@code ack} envelope before counting a delivery as done. */
        private boolean requireAck = true;

        private long ackTimeoutMs = 10_000;
    }
}
