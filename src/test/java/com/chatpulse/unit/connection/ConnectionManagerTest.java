package com.chatpulse.unit.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatpulse.auth.AuthFlow;
import com.chatpulse.auth.AuthStrategy;
import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.connection.ConnectionState;
import com.chatpulse.connection.ConnectionStatus;
import com.chatpulse.event.AuthEvent;
import com.chatpulse.event.AuthEventType;
import com.chatpulse.event.ClientErrorEvent;
import com.chatpulse.event.ConnectionEvent;
import com.chatpulse.event.ConnectionEventType;
import com.chatpulse.exception.ClientTimeoutException;
import com.chatpulse.exception.ConnectionException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.FailureCategory;
import com.chatpulse.exception.SessionStoreException;
import com.chatpulse.session.AuthMethod;
import com.chatpulse.session.FileSessionStore;
import com.chatpulse.session.InMemorySessionStore;
import com.chatpulse.session.Session;
import com.chatpulse.session.SessionCodec;
import com.chatpulse.support.FakeTransport;
import com.chatpulse.support.TestClient;
import com.chatpulse.transport.Envelope;
import com.chatpulse.transport.EnvelopeTypes;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ConnectionManager covering connect, authentication hand-off, session
 * restore, connection loss, reconnect backoff and exhaustion, heartbeat staleness and teardown.
 */
class ConnectionManagerTest {

    private TestClient client;
    private FakeTransport transport;
    private InMemorySessionStore sessionStore;
    private SessionCodec sessionCodec;
    private ConnectionManager manager;
    private final List<ConnectionState> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = new TestClient();
        client.properties.setAuthStrategy(AuthStrategy.QR);
        client.properties.setConnectTimeoutMs(30_000);
        client.properties.setAuthTimeoutMs(20_000);
        client.properties.setHeartbeatIntervalMs(30_000);
        client.properties.setHeartbeatMissedThreshold(2);
        client.properties.setReconnectBaseDelayMs(1_000);
        client.properties.setReconnectMaxDelayMs(60_000);
        client.properties.setMaxReconnectAttempts(3);
        transport = new FakeTransport();
        sessionStore = new InMemorySessionStore();
        sessionCodec = new SessionCodec();
        buildManager();
    }

    private void buildManager() {
        AuthFlow authFlow = new AuthFlow(client.context(), transport);
        manager = new ConnectionManager(client.context(), transport, authFlow, sessionStore, sessionCodec);
        manager.addStateListener((previous, current) -> transitions.add(current));
    }

    private void connectAndOpen() {
        manager.connect();
        transport.completeOpen();
    }

    private void reachReady() {
        connectAndOpen();
        transport.receive(EnvelopeTypes.AUTH_SUCCESS, Map.of("sessionId", "sess-1", "token", "tok-1"));
        assertThat(manager.getState()).isEqualTo(ConnectionState.READY);
        client.published.clear();
        transitions.clear();
    }

    private List<ConnectionEventType> connectionEvents() {
        return client.published.ofType(ConnectionEvent.class).stream()
                .map(ConnectionEvent::getEventType)
                .collect(Collectors.toList());
    }

    private void storeSession(Session session) {
        sessionStore.save(client.properties.getSessionName(), sessionCodec.encode(session));
    }

    @Nested
    @DisplayName("Connect")
    class Connect {

        @Test
        @DisplayName("connect moves to CONNECTING and completes once the transport opens")
        void connectCompletesOnOpen() {
            CompletableFuture<Void> result = manager.connect();
            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTING);
            assertThat(result).isNotDone();

            transport.completeOpen();

            assertThat(result).isCompleted();
            assertThat(connectionEvents()).containsExactly(ConnectionEventType.CONNECTED);
        }

        @Test
        @DisplayName("With no stored session the configured QR flow starts automatically")
        void startsConfiguredFlow() {
            connectAndOpen();

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).hasSize(1);
            assertThat(transitions).containsExactly(
                    ConnectionState.CONNECTING, ConnectionState.CONNECTED, ConnectionState.AUTHENTICATING);
        }

        @Test
        @DisplayName("MANUAL strategy waits in CONNECTED for an explicit call")
        void manualStrategyWaits() {
            client.properties.setAuthStrategy(AuthStrategy.MANUAL);

            connectAndOpen();

            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(transport.sent()).isEmpty();
        }

        @Test
        @DisplayName("connect outside DISCONNECTED fails with INVALID_STATE")
        void connectTwiceRejected() {
            manager.connect();

            assertThatThrownBy(() -> manager.connect())
                    .isInstanceOf(ConnectionException.class)
                    .extracting(e -> ((ConnectionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_STATE);
        }

        @Test
        @DisplayName("A failed first open returns to DISCONNECTED without reconnecting")
        void initialOpenFailure() {
            CompletableFuture<Void> result = manager.connect();

            transport.failOpen(new IOException("Connection refused"));
            client.scheduler.advanceMillis(120_000);

            assertThat(result).isCompletedExceptionally();
            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(transport.openCount()).isEqualTo(1);
            assertThat(client.published.ofType(ConnectionEvent.class)).isEmpty();
        }

        @Test
        @DisplayName("An open that never settles times out with CONNECT_TIMEOUT")
        void openTimeout() {
            CompletableFuture<Void> result = manager.connect();

            client.scheduler.advanceMillis(30_000);

            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            Throwable error = result.handle((ok, e) -> e).join();
            assertThat(error).isInstanceOf(ClientTimeoutException.class);
            assertThat(((ClientTimeoutException) error).getErrorCode()).isEqualTo(ErrorCode.CONNECT_TIMEOUT);
        }
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("auth_success publishes AUTHENTICATED then READY exactly once and persists the session")
        void readyAfterAuth() {
            connectAndOpen();
            client.published.clear();

            transport.receive(EnvelopeTypes.AUTH_SUCCESS, Map.of("sessionId", "sess-1", "token", "tok-1"));

            assertThat(manager.isReady()).isTrue();
            List<Object> events = client.published.all();
            assertThat(events).hasSize(2);
            assertThat(events.get(0)).isInstanceOfSatisfying(AuthEvent.class, e -> {
                assertThat(e.getEventType()).isEqualTo(AuthEventType.AUTHENTICATED);
                assertThat(e.getSessionId()).isEqualTo("sess-1");
            });
            assertThat(events.get(1)).isInstanceOfSatisfying(ConnectionEvent.class, e ->
                    assertThat(e.getEventType()).isEqualTo(ConnectionEventType.READY));
            assertThat(sessionStore.exists(client.properties.getSessionName())).isTrue();
            assertThat(manager.getSession().isAuthenticated()).isTrue();
        }

        @Test
        @DisplayName("A failed challenge returns to CONNECTED and reports the error")
        void failedChallenge() {
            connectAndOpen();

            client.scheduler.advanceMillis(client.properties.getAuthTimeoutMs());

            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .contains(ErrorCode.AUTH_TIMEOUT);
        }

        @Test
        @DisplayName("Explicit pairing replaces the running QR flow")
        void explicitPairing() {
            connectAndOpen();

            CompletableFuture<Session> pairing = manager.authenticateWithPairing("+44 20 7946 0958");

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.PAIRING_REQUEST);
            assertThat(pairing).isNotDone();
        }

        @Test
        @DisplayName("Authenticating requires an open, not-yet-ready connection")
        void authenticateRequiresConnection() {
            assertThatThrownBy(() -> manager.authenticateWithQR())
                    .extracting(e -> ((ConnectionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.NOT_CONNECTED);

            reachReady();

            assertThatThrownBy(() -> manager.authenticateWithQR())
                    .extracting(e -> ((ConnectionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_STATE);
        }

        @Test
        @DisplayName("send outside READY fails with NOT_READY")
        void sendRequiresReady() {
            connectAndOpen();

            assertThatThrownBy(() -> manager.send(Envelope.of(EnvelopeTypes.OPERATION, Map.of(), 0L)))
                    .isInstanceOf(ConnectionException.class)
                    .extracting(e -> ((ConnectionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.NOT_READY);
        }

        @Test
        @DisplayName("Non-auth inbound envelopes reach the inbound listeners")
        void inboundForwarded() {
            List<Envelope> inbound = new ArrayList<>();
            manager.addInboundListener(inbound::add);
            reachReady();

            transport.receive("message", Map.of("from", "alice", "text", "hi"));

            assertThat(inbound).singleElement().satisfies(e -> assertThat(e.getType()).isEqualTo("message"));
        }
    }

    @Nested
    @DisplayName("Auto Strategy")
    class AutoStrategy {

        @BeforeEach
        void useAuto() {
            client.properties.setAuthStrategy(AuthStrategy.AUTO);
            client.properties.setPairingPhoneNumber("+1 415 555 0132");
        }

        @Test
        @DisplayName("A configured phone number starts pairing first")
        void pairingFirst() {
            connectAndOpen();

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.sent(EnvelopeTypes.PAIRING_REQUEST)).hasSize(1);
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).isEmpty();
        }

        @Test
        @DisplayName("A rejected pairing falls back to QR on the same connection")
        void rejectedPairingFallsBackToQr() {
            connectAndOpen();

            transport.receive(EnvelopeTypes.AUTH_FAILURE, Map.of("reason", "pairing declined"));

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.QR_REQUEST);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .containsExactly(ErrorCode.AUTH_REJECTED);

            transport.receive(EnvelopeTypes.AUTH_SUCCESS, Map.of("sessionId", "sess-qr", "token", "tok-qr"));

            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getSession().getAuthMethod()).isEqualTo(AuthMethod.QR);
        }

        @Test
        @DisplayName("A pairing that times out falls back to QR")
        void timedOutPairingFallsBackToQr() {
            connectAndOpen();

            client.scheduler.advanceMillis(client.properties.getAuthTimeoutMs());

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).isNotEmpty();
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .contains(ErrorCode.AUTH_TIMEOUT);
        }

        @Test
        @DisplayName("Without a phone number QR starts directly")
        void noPhoneStartsQr() {
            client.properties.setPairingPhoneNumber(null);

            connectAndOpen();

            assertThat(transport.sent(EnvelopeTypes.PAIRING_REQUEST)).isEmpty();
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).hasSize(1);
        }

        @Test
        @DisplayName("An unusable phone number is reported and QR starts instead")
        void invalidPhoneFallsBackToQr() {
            client.properties.setPairingPhoneNumber("call me");

            connectAndOpen();

            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(transport.sent(EnvelopeTypes.PAIRING_REQUEST)).isEmpty();
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).hasSize(1);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .containsExactly(ErrorCode.INVALID_PHONE_NUMBER);
        }

        @Test
        @DisplayName("Under a fixed strategy a failed pairing does not start QR")
        void fixedPairingDoesNotFallBack() {
            client.properties.setAuthStrategy(AuthStrategy.PAIRING);

            connectAndOpen();
            transport.receive(EnvelopeTypes.AUTH_FAILURE, Map.of("reason", "pairing declined"));

            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Session Restore")
    class SessionRestore {

        private Session restorable() {
            return Session.builder()
                    .id("sess-7")
                    .authenticated(true)
                    .authMethod(AuthMethod.QR)
                    .createdAt(client.scheduler.now().minus(Duration.ofDays(1)))
                    .expiresAt(client.scheduler.now().plus(Duration.ofDays(5)))
                    .token("tok-7")
                    .build();
        }

        @Test
        @DisplayName("A stored session is restored straight from CONNECTED to READY")
        void restoresStoredSession() {
            storeSession(restorable());

            connectAndOpen();
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.SESSION_RESTORE);
            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);

            transport.receive(EnvelopeTypes.AUTH_SUCCESS, Map.of());

            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getSession().getId()).isEqualTo("sess-7");
            assertThat(manager.getSession().getAuthMethod()).isEqualTo(AuthMethod.RESTORE);
            assertThat(transitions).doesNotContain(ConnectionState.AUTHENTICATING);
        }

        @Test
        @DisplayName("A rejected restore discards the stored session and falls back to QR")
        void rejectedRestoreFallsBack() {
            storeSession(restorable());
            connectAndOpen();

            transport.receive(EnvelopeTypes.AUTH_FAILURE, Map.of("reason", "session revoked"));

            assertThat(sessionStore.exists(client.properties.getSessionName())).isFalse();
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.QR_REQUEST);
            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .containsExactly(ErrorCode.AUTH_REJECTED);
        }

        @Test
        @DisplayName("An expired stored session is deleted without a restore round trip")
        void expiredSessionDiscarded() {
            storeSession(restorable().toBuilder()
                    .expiresAt(client.scheduler.now().minusSeconds(1))
                    .build());

            connectAndOpen();

            assertThat(transport.sent(EnvelopeTypes.SESSION_RESTORE)).isEmpty();
            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).hasSize(1);
            assertThat(sessionStore.exists(client.properties.getSessionName())).isFalse();
        }

        @Test
        @DisplayName("A store failing outside its contract is reported and authentication still starts")
        void brokenStoreReported() {
            sessionStore = new InMemorySessionStore() {
                @Override
                public Optional<byte[]> load(String name) {
                    throw new IllegalStateException("disk unplugged");
                }
            };
            buildManager();

            connectAndOpen();

            assertThat(transport.sent(EnvelopeTypes.QR_REQUEST)).hasSize(1);
            assertThat(manager.getState()).isEqualTo(ConnectionState.AUTHENTICATING);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .containsExactly(ErrorCode.SESSION_STORE_ERROR);
        }

        @Test
        @DisplayName("A session name the store cannot hold fails construction")
        void unsafeSessionNameRejectedAtConstruction() {
            client.properties.setSessionName("../escape");
            FileSessionStore fileStore = new FileSessionStore(Path.of("target", "sessions"));

            assertThatThrownBy(() -> new ConnectionManager(
                            client.context(), transport, new AuthFlow(client.context(), transport), fileStore, sessionCodec))
                    .isInstanceOf(SessionStoreException.class)
                    .hasMessageContaining("../escape");
        }

        @Test
        @DisplayName("Restore is skipped when disabled")
        void restoreDisabled() {
            client.properties.setRestoreSession(false);
            storeSession(restorable());

            connectAndOpen();

            assertThat(transport.sent(EnvelopeTypes.SESSION_RESTORE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Connection Loss")
    class ConnectionLoss {

        @Test
        @DisplayName("Losing a READY connection schedules a reconnect with base backoff")
        void lossSchedulesReconnect() {
            reachReady();

            transport.remoteClose(1006, "abnormal closure");

            assertThat(manager.getState()).isEqualTo(ConnectionState.RECONNECTING);
            assertThat(connectionEvents())
                    .containsExactly(ConnectionEventType.DISCONNECTED, ConnectionEventType.RECONNECTING);
            ConnectionEvent reconnecting = client.published.ofType(ConnectionEvent.class).get(1);
            assertThat(reconnecting.getAttempt()).isEqualTo(1);
            assertThat(reconnecting.getDelay()).isEqualTo(Duration.ofSeconds(1));
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getCategory()).isEqualTo(FailureCategory.NETWORK));
        }

        @Test
        @DisplayName("A successful reconnect restores the session and resets the attempt counter")
        void reconnectRestores() {
            reachReady();
            transport.remoteClose(1006, null);

            client.scheduler.advanceMillis(1_000);
            assertThat(transport.openCount()).isEqualTo(2);
            transport.completeOpen();
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.SESSION_RESTORE);
            transport.receive(EnvelopeTypes.AUTH_SUCCESS, Map.of());

            assertThat(manager.isReady()).isTrue();
            assertThat(manager.getStatus().getReconnectAttempts()).isZero();
            assertThat(connectionEvents()).containsOnlyOnce(ConnectionEventType.READY);
        }

        @Test
        @DisplayName("Reconnect gives up after maxReconnectAttempts and parks in FAILED")
        void reconnectExhaustion() {
            reachReady();
            transport.remoteClose(1006, null);

            client.scheduler.advanceMillis(1_000);
            transport.failOpen(new IOException("Connection refused"));
            client.scheduler.advanceMillis(2_000);
            transport.failOpen(new IOException("Connection refused"));
            client.scheduler.advanceMillis(4_000);
            transport.failOpen(new IOException("Connection refused"));

            assertThat(manager.getState()).isEqualTo(ConnectionState.FAILED);
            assertThat(transport.openCount()).isEqualTo(4);
            assertThat(client.published.ofType(ConnectionEvent.class, e ->
                            e.getEventType() == ConnectionEventType.RECONNECTING))
                    .extracting(ConnectionEvent::getDelay)
                    .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
            assertThat(connectionEvents()).containsOnlyOnce(ConnectionEventType.MAX_RECONNECT_ATTEMPTS_REACHED);
            assertThat(client.published.ofType(ClientErrorEvent.class, e ->
                            e.getErrorCode() == ErrorCode.RECONNECT_EXHAUSTED))
                    .singleElement()
                    .satisfies(e -> assertThat(e.isRecoverable()).isFalse());

            client.scheduler.advanceMillis(600_000);
            assertThat(transport.openCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("disconnect from FAILED resets so connect works again")
        void disconnectResetsFailed() {
            reachReady();
            transport.remoteClose(1006, null);
            for (int delay : new int[] {1_000, 2_000, 4_000}) {
                client.scheduler.advanceMillis(delay);
                transport.failOpen(new IOException("down"));
            }

            manager.disconnect();
            connectAndOpen();

            assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);
        }

        @Test
        @DisplayName("A connection that never reached READY is not reconnected")
        void noReconnectBeforeReady() {
            connectAndOpen();

            transport.remoteClose(1006, null);
            client.scheduler.advanceMillis(60_000);

            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(transport.openCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("No reconnect when auto-reconnect is off")
        void autoReconnectOff() {
            client.properties.setAutoReconnect(false);
            buildManager();
            reachReady();

            transport.remoteClose(1006, null);

            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(connectionEvents()).containsExactly(ConnectionEventType.DISCONNECTED);
        }

        @Test
        @DisplayName("An auth-classified close drops the stored session before reconnecting")
        void authCloseInvalidatesSession() {
            reachReady();

            transport.remoteClose(4001, "unauthorized");

            assertThat(sessionStore.exists(client.properties.getSessionName())).isFalse();
            assertThat(manager.getSession().isAuthenticated()).isFalse();

            client.scheduler.advanceMillis(1_000);
            transport.completeOpen();
            assertThat(transport.sent(EnvelopeTypes.SESSION_RESTORE)).isEmpty();
            assertThat(transport.lastSent().getType()).isEqualTo(EnvelopeTypes.QR_REQUEST);
        }

        @Test
        @DisplayName("A silent connection is torn down by the heartbeat")
        void heartbeatStale() {
            reachReady();

            client.scheduler.advanceMillis(90_000);

            assertThat(manager.getState()).isEqualTo(ConnectionState.RECONNECTING);
            assertThat(client.published.ofType(ClientErrorEvent.class))
                    .extracting(ClientErrorEvent::getErrorCode)
                    .containsExactly(ErrorCode.HEARTBEAT_TIMEOUT);
        }

        @Test
        @DisplayName("Pongs keep the connection alive")
        void pongsKeepAlive() {
            reachReady();

            for (int i = 0; i < 10; i++) {
                client.scheduler.advanceMillis(30_000);
                transport.pong();
            }

            assertThat(manager.isReady()).isTrue();
            assertThat(transport.pingCount()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Teardown")
    class Teardown {

        @Test
        @DisplayName("disconnect publishes one DISCONNECTED and is idempotent")
        void disconnectIdempotent() {
            reachReady();

            manager.disconnect();
            manager.disconnect();

            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(connectionEvents()).containsExactly(ConnectionEventType.DISCONNECTED);
            assertThat(client.scheduler.pendingCount()).isZero();
        }

        @Test
        @DisplayName("disconnect while already DISCONNECTED publishes nothing")
        void disconnectWhenIdle() {
            manager.disconnect();

            assertThat(client.published.all()).isEmpty();
        }

        @Test
        @DisplayName("disconnect during a pending open fails the connect future")
        void disconnectDuringOpen() {
            CompletableFuture<Void> result = manager.connect();

            manager.disconnect();
            transport.completeOpen();

            assertThat(result).isCompletedExceptionally();
            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        }

        @Test
        @DisplayName("disconnect cancels a pending reconnect")
        void disconnectCancelsReconnect() {
            reachReady();
            transport.remoteClose(1006, null);

            manager.disconnect();
            client.scheduler.advanceMillis(60_000);

            assertThat(transport.openCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("logout forgets the session locally and in the store")
        void logoutForgetsSession() {
            reachReady();
            String oldId = manager.getSession().getId();

            manager.logout();

            assertThat(manager.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(sessionStore.exists(client.properties.getSessionName())).isFalse();
            assertThat(manager.getSession().isAuthenticated()).isFalse();
            assertThat(manager.getSession().getId()).isNotEqualTo(oldId);
        }
    }

    @Test
    @DisplayName("Status reflects the live connection")
    void statusSnapshot() {
        reachReady();

        ConnectionStatus status = manager.getStatus();

        assertThat(status.isReady()).isTrue();
        assertThat(status.getSessionId()).isEqualTo("sess-1");
        assertThat(status.getAuthMethod()).isEqualTo(AuthMethod.QR);
        assertThat(status.getConnectedAt()).isNotNull();
        assertThat(status.getMaxReconnectAttempts()).isEqualTo(3);
        assertThat(status.isAuthInProgress()).isFalse();
    }
}
