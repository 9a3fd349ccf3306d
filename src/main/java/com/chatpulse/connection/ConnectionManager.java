package com.chatpulse.connection;

import com.chatpulse.auth.AuthFlow;
import com.chatpulse.auth.AuthStrategy;
import com.chatpulse.auth.PhoneNumberValidator;
import com.chatpulse.config.ChatPulseProperties;
import com.chatpulse.config.ClientContext;
import com.chatpulse.event.EventPublisherHelper;
import com.chatpulse.exception.AuthenticationException;
import com.chatpulse.exception.ChatPulseException;
import com.chatpulse.exception.ClientTimeoutException;
import com.chatpulse.exception.ConnectionException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ErrorKind;
import com.chatpulse.exception.FailureCategory;
import com.chatpulse.exception.SessionStoreException;
import com.chatpulse.exception.ValidationException;
import com.chatpulse.session.AuthMethod;
import com.chatpulse.session.Session;
import com.chatpulse.session.SessionCodec;
import com.chatpulse.session.SessionStore;
import com.chatpulse.transport.Envelope;
import com.chatpulse.transport.EnvelopeTypes;
import com.chatpulse.transport.Transport;
import com.chatpulse.transport.TransportListener;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single source of truth for connectivity: owns the {@link Transport}, the
 * {@link ConnectionState}, the {@link Session}, the heartbeat and the reconnect backoff.
 *
 * <p>After the transport opens, authentication starts by itself: a stored, unexpired
 * session is restored when possible (straight to READY), otherwise the configured
 * {@link com.chatpulse.auth.AuthStrategy} runs.
 *
 * <p>Losing the connection from CONNECTED, AUTHENTICATING or READY moves to DISCONNECTED.
 * If auto-reconnect is on and the client has been READY before, a reconnect is scheduled
 * with {@link ReconnectPolicy} backoff. The attempt counter resets on READY; once it reaches
 * {@code maxReconnectAttempts} the manager parks in FAILED and publishes
 * {@code MAX_RECONNECT_ATTEMPTS_REACHED} once. Auth-classified failures delete the stored
 * session first.
 *
 * <p>Concurrency: state lives behind one lock. Every connection attempt and every teardown
 * bumps an epoch; asynchronous completions (transport open, auth flows, timers) carry the
 * epoch they were started under and are dropped when it no longer matches. Events and
 * listener callbacks run after the lock is released, and no I/O happens while holding it.
 */
public class ConnectionManager implements TransportListener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ClientContext context;
    private final ChatPulseProperties properties;
    private final EventPublisherHelper events;
    private final Transport transport;
    private final AuthFlow authFlow;
    private final SessionStore sessionStore;
    private final SessionCodec sessionCodec;
    private final ReconnectPolicy reconnectPolicy;
    private final FailureClassifier failureClassifier = new FailureClassifier();
    private final HeartbeatMonitor heartbeat;
    private final URI uri;
    private final Duration connectTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Envelope>> inboundListeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private long epoch;
    private int reconnectAttempts;
    private boolean wasAuthenticated;
    private Session session;
    private Instant connectedAt;
    private ScheduledFuture<?> openTimer;
    private ScheduledFuture<?> reconnectTimer;
    private CompletableFuture<Void> pendingConnect;

    public ConnectionManager(
            ClientContext context,
            Transport transport,
            AuthFlow authFlow,
            SessionStore sessionStore,
            SessionCodec sessionCodec) {
        this.context = context;
        this.properties = context.getProperties();
        this.events = context.getEvents();
        this.transport = transport;
        this.authFlow = authFlow;
        this.sessionStore = sessionStore;
        this.sessionCodec = sessionCodec;
        sessionStore.validateName(properties.getSessionName());
        this.reconnectPolicy = new ReconnectPolicy(
                properties.getReconnectBaseDelayMs(),
                properties.getReconnectMaxDelayMs(),
                properties.getMaxReconnectAttempts());
        this.heartbeat = new HeartbeatMonitor(context, transport, this::onHeartbeatStale);
        this.uri = URI.create(properties.getTransport().getUrl());
        this.connectTimeout = Duration.ofMillis(properties.getConnectTimeoutMs());
        this.session = freshSession();
        transport.setListener(this);
    }

    // ---- Public lifecycle ----

    /**
     * Opens the transport. The future completes once the transport is open (CONNECTED);
     * authentication continues in the background.
     *
     * @throws ConnectionException with INVALID_STATE unless DISCONNECTED
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        long attemptEpoch;
        lock.lock();
        try {
            ConnectionState current = state.get();
            if (current != ConnectionState.DISCONNECTED) {
                throw new ConnectionException(
                        ErrorCode.INVALID_STATE, "connect() requires DISCONNECTED, current state is " + current);
            }
            attemptEpoch = ++epoch;
            reconnectAttempts = 0;
            pendingConnect = result;
            state.set(ConnectionState.CONNECTING);
        } finally {
            lock.unlock();
        }
        notifyListeners(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
        log.info("Connecting to {}", uri);
        openTransport(attemptEpoch);
        return result;
    }

    /**
     * Tears everything down: heartbeat, backoff, pending open and any auth flow. A no-op when
     * already DISCONNECTED. From FAILED this resets the manager so {@link #connect()} works again.
     */
    public void disconnect() {
        ConnectionState previous;
        CompletableFuture<Void> abandonedConnect;
        lock.lock();
        try {
            previous = state.get();
            if (previous == ConnectionState.DISCONNECTED) {
                return;
            }
            epoch++;
            cancelTimersLocked();
            abandonedConnect = pendingConnect;
            pendingConnect = null;
            state.set(ConnectionState.DISCONNECTED);
        } finally {
            lock.unlock();
        }
        heartbeat.stop();
        authFlow.cancel();
        transport.close();
        if (abandonedConnect != null) {
            abandonedConnect.completeExceptionally(
                    new ConnectionException(ErrorCode.CONNECTION_LOST, "Disconnected before the transport opened"));
        }
        log.info("Disconnected (was {})", previous);
        events.publishDisconnected(this, previous, "Disconnected by client");
        notifyListeners(previous, ConnectionState.DISCONNECTED);
    }

    /** Disconnects and forgets the session, locally and in the store. */
    public void logout() {
        disconnect();
        lock.lock();
        try {
            session = freshSession();
            wasAuthenticated = false;
        } finally {
            lock.unlock();
        }
        deleteStoredSession();
        log.info("Logged out, stored session '{}' removed", properties.getSessionName());
    }

    /**
     * Starts (or restarts) the QR flow.
     *
     * @throws ConnectionException unless CONNECTED or AUTHENTICATING
     */
    public CompletableFuture<Session> authenticateWithQR() {
        long current = requireAuthenticatable();
        return beginChallenge(current, AuthMethod.QR, authFlow::startQr);
    }

    /**
     * Starts (or restarts) the pairing flow.
     *
     * @throws com.chatpulse.exception.ValidationException for a malformed phone number
     * @throws ConnectionException unless CONNECTED or AUTHENTICATING
     */
    public CompletableFuture<Session> authenticateWithPairing(String phoneNumber) {
        String digits = PhoneNumberValidator.normalize(phoneNumber);
        long current = requireAuthenticatable();
        return beginChallenge(current, AuthMethod.PAIRING, () -> authFlow.startPairing(digits));
    }

    /**
     * Writes one envelope to the wire.
     *
     * @throws ConnectionException with NOT_READY outside READY
     * @throws com.chatpulse.exception.TransportException if the write fails
     */
    public void send(Envelope envelope) {
        ConnectionState current = state.get();
        if (current != ConnectionState.READY) {
            throw new ConnectionException(ErrorCode.NOT_READY, "Cannot send while " + current);
        }
        transport.send(envelope);
    }

    public void addStateListener(ConnectionStateListener listener) {
        stateListeners.add(listener);
    }

    /** Receives inbound envelopes that are not authentication control messages. */
    public void addInboundListener(Consumer<Envelope> listener) {
        inboundListeners.add(listener);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == ConnectionState.READY;
    }

    public Session getSession() {
        lock.lock();
        try {
            return session.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    public ConnectionStatus getStatus() {
        boolean authInProgress = authFlow.isActive();
        lock.lock();
        try {
            return ConnectionStatus.builder()
                    .state(state.get())
                    .sessionId(session.getId())
                    .authenticated(session.isAuthenticated())
                    .authMethod(session.getAuthMethod())
                    .connectedAt(state.get().isLive() ? connectedAt : null)
                    .lastPongAt(heartbeat.getLastPongAt())
                    .reconnectAttempts(reconnectAttempts)
                    .maxReconnectAttempts(reconnectPolicy.getMaxAttempts())
                    .authInProgress(authInProgress)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ---- Transport callbacks ----

    @Override
    public void onMessage(Envelope envelope) {
        try {
            switch (envelope.getType()) {
                case EnvelopeTypes.QR_UPDATE -> authFlow.onQrUpdate(envelope);
                case EnvelopeTypes.PAIRING_CODE -> authFlow.onPairingCode(envelope);
                case EnvelopeTypes.AUTH_SUCCESS -> authFlow.onAuthSuccess(envelope);
                case EnvelopeTypes.AUTH_FAILURE -> authFlow.onAuthFailure(envelope);
                default -> inboundListeners.forEach(listener -> listener.accept(envelope));
            }
        } catch (RuntimeException e) {
            log.error("Error handling inbound {} envelope: {}", envelope.getType(), e.getMessage(), e);
        }
    }

    @Override
    public void onClose(int code, String reason) {
        FailureCategory category = failureClassifier.classify(code, reason);
        String message = "Connection closed (code=" + code + (reason != null && !reason.isBlank() ? ", " + reason : "")
                + ")";
        handleConnectionLost(new ConnectionException(ErrorCode.CONNECTION_LOST, message, category, null), category);
    }

    @Override
    public void onPong() {
        heartbeat.recordPong();
    }

    @Override
    public void onError(Throwable error) {
        FailureCategory category = failureClassifier.classify(error);
        handleConnectionLost(
                new ConnectionException(
                        ErrorCode.TRANSPORT_ERROR, "Transport error: " + error.getMessage(), category, error),
                category);
    }

    // ---- Opening ----

    private void openTransport(long attemptEpoch) {
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<Void> opening;
        try {
            opening = transport.open(uri, properties.getTransport().getHeaders(), connectTimeout);
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> open = opening;

        ScheduledFuture<?> timer = context.getScheduler()
                .schedule(
                        () -> {
                            if (settled.compareAndSet(false, true)) {
                                open.cancel(false);
                                onOpenFailed(
                                        attemptEpoch,
                                        new ClientTimeoutException(
                                                ErrorCode.CONNECT_TIMEOUT,
                                                "Transport open did not complete within "
                                                        + connectTimeout.toMillis() + "ms"));
                            }
                        },
                        context.now().plus(connectTimeout));

        lock.lock();
        try {
            if (epoch == attemptEpoch) {
                openTimer = timer;
            }
        } finally {
            lock.unlock();
        }

        open.whenComplete((ignored, error) -> {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            timer.cancel(false);
            if (error == null) {
                onOpened(attemptEpoch);
            } else {
                onOpenFailed(attemptEpoch, unwrap(error));
            }
        });
    }

    private void onOpened(long attemptEpoch) {
        ConnectionState previous;
        CompletableFuture<Void> connectResult;
        lock.lock();
        try {
            previous = state.get();
            if (epoch != attemptEpoch
                    || (previous != ConnectionState.CONNECTING && previous != ConnectionState.RECONNECTING)) {
                log.debug("Ignoring stale transport open (epoch {})", attemptEpoch);
                return;
            }
            openTimer = null;
            connectedAt = context.now();
            state.set(ConnectionState.CONNECTED);
            connectResult = pendingConnect;
            pendingConnect = null;
        } finally {
            lock.unlock();
        }

        log.info("Transport open ({} -> CONNECTED)", previous);
        events.publishConnected(this, previous, ConnectionState.CONNECTED);
        notifyListeners(previous, ConnectionState.CONNECTED);
        heartbeat.start();
        if (connectResult != null) {
            connectResult.complete(null);
        }
        beginAuthentication(attemptEpoch);
    }

    private void onOpenFailed(long attemptEpoch, Throwable error) {
        FailureCategory category = failureClassifier.classify(error);
        ConnectionState previous;
        CompletableFuture<Void> connectResult = null;
        ReconnectStep nextStep = null;
        int failedAttempts = 0;

        lock.lock();
        try {
            previous = state.get();
            if (epoch != attemptEpoch) {
                return;
            }
            openTimer = null;
            if (previous == ConnectionState.CONNECTING) {
                state.set(ConnectionState.DISCONNECTED);
                connectResult = pendingConnect;
                pendingConnect = null;
            } else if (previous == ConnectionState.RECONNECTING) {
                failedAttempts = ++reconnectAttempts;
                if (reconnectPolicy.isExhausted(failedAttempts)) {
                    state.set(ConnectionState.FAILED);
                } else {
                    nextStep = scheduleReconnectLocked();
                }
            } else {
                return;
            }
        } finally {
            lock.unlock();
        }

        transport.close();
        ChatPulseException failure = error instanceof ClientTimeoutException timeout
                ? timeout
                : new ConnectionException(
                        ErrorCode.CONNECT_FAILED, "Transport open failed: " + describe(error), category, error);

        if (connectResult != null) {
            log.warn("Connect failed: {}", failure.getMessage());
            notifyListeners(previous, ConnectionState.DISCONNECTED);
            connectResult.completeExceptionally(failure);
            return;
        }

        log.warn(
                "Reconnect attempt {}/{} failed: {}",
                failedAttempts,
                reconnectPolicy.getMaxAttempts(),
                failure.getMessage());
        events.publishError(this, failure);
        if (nextStep != null) {
            events.publishReconnecting(this, nextStep.attempt(), nextStep.delay());
        } else {
            log.error("Giving up after {} reconnect attempts, operator intervention required", failedAttempts);
            events.publishMaxReconnectAttemptsReached(this, failedAttempts);
            events.publishError(
                    this,
                    ErrorKind.CONNECTION,
                    ErrorCode.RECONNECT_EXHAUSTED,
                    category,
                    "Reconnect attempts exhausted after " + failedAttempts + " tries",
                    false);
            notifyListeners(ConnectionState.RECONNECTING, ConnectionState.FAILED);
        }
    }

    // ---- Authentication ----

    private void beginAuthentication(long attemptEpoch) {
        Optional<Session> stored = properties.isRestoreSession() ? loadStoredSession() : Optional.empty();
        if (stored.isPresent() && stored.get().isRestorable(context.now())) {
            lock.lock();
            try {
                if (epoch != attemptEpoch || state.get() != ConnectionState.CONNECTED) {
                    return;
                }
            } finally {
                lock.unlock();
            }
            attachAuth(attemptEpoch, authFlow.restore(stored.get()), AuthMethod.RESTORE);
            return;
        }
        if (stored.isPresent()) {
            log.info("Stored session {} is expired or incomplete, discarding", stored.get().getId());
            deleteStoredSession();
        }
        startConfiguredFlow(attemptEpoch);
    }

    private void startConfiguredFlow(long attemptEpoch) {
        AuthStrategy strategy = properties.getAuthStrategy();
        String phone = properties.getPairingPhoneNumber();
        boolean hasPhone = phone != null && !phone.isBlank();
        try {
            switch (strategy) {
                case QR -> startQrFlow(attemptEpoch);
                case PAIRING -> {
                    if (hasPhone) {
                        startPairingFlow(attemptEpoch, phone);
                    } else {
                        log.warn("Pairing strategy configured without a phone number, waiting for explicit call");
                    }
                }
                case AUTO -> {
                    if (hasPhone) {
                        startPairingOrFallBack(attemptEpoch, phone);
                    } else {
                        startQrFlow(attemptEpoch);
                    }
                }
                case MANUAL -> log.info("Transport open, waiting for an explicit authentication call");
            }
        } catch (ChatPulseException e) {
            log.warn("Could not start {} authentication: {}", strategy, e.getMessage());
            events.publishError(this, e);
        }
    }

    private void startQrFlow(long attemptEpoch) {
        beginChallenge(attemptEpoch, AuthMethod.QR, authFlow::startQr);
    }

    private void startPairingFlow(long attemptEpoch, String phone) {
        beginChallenge(attemptEpoch, AuthMethod.PAIRING, () -> authFlow.startPairing(phone));
    }

    private void startPairingOrFallBack(long attemptEpoch, String phone) {
        try {
            startPairingFlow(attemptEpoch, phone);
        } catch (ValidationException e) {
            log.warn("Pairing could not start ({}), falling back to QR", e.getMessage());
            events.publishError(this, e);
            startQrFlow(attemptEpoch);
        }
    }

    private long requireAuthenticatable() {
        lock.lock();
        try {
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTED || current == ConnectionState.AUTHENTICATING) {
                return epoch;
            }
            ErrorCode code = current == ConnectionState.READY ? ErrorCode.INVALID_STATE : ErrorCode.NOT_CONNECTED;
            throw new ConnectionException(code, "Cannot authenticate while " + current);
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Session> beginChallenge(
            long attemptEpoch, AuthMethod method, Supplier<CompletableFuture<Session>> starter) {
        ConnectionState previous;
        lock.lock();
        try {
            previous = state.get();
            if (epoch != attemptEpoch
                    || (previous != ConnectionState.CONNECTED && previous != ConnectionState.AUTHENTICATING)) {
                throw new ConnectionException(ErrorCode.NOT_CONNECTED, "Connection changed before " + method + " started");
            }
            state.set(ConnectionState.AUTHENTICATING);
        } finally {
            lock.unlock();
        }
        if (previous != ConnectionState.AUTHENTICATING) {
            notifyListeners(previous, ConnectionState.AUTHENTICATING);
        }
        CompletableFuture<Session> flow;
        try {
            flow = starter.get();
        } catch (RuntimeException e) {
            revertToConnected(attemptEpoch);
            throw e;
        }
        attachAuth(attemptEpoch, flow, method);
        return flow;
    }

    private void revertToConnected(long attemptEpoch) {
        lock.lock();
        try {
            if (epoch != attemptEpoch || state.get() != ConnectionState.AUTHENTICATING) {
                return;
            }
            state.set(ConnectionState.CONNECTED);
        } finally {
            lock.unlock();
        }
        notifyListeners(ConnectionState.AUTHENTICATING, ConnectionState.CONNECTED);
    }

    private void attachAuth(long attemptEpoch, CompletableFuture<Session> flow, AuthMethod method) {
        flow.whenComplete((authenticated, error) -> {
            if (error == null) {
                onAuthenticated(attemptEpoch, authenticated);
            } else {
                onAuthFailed(attemptEpoch, unwrap(error), method);
            }
        });
    }

    private void onAuthenticated(long attemptEpoch, Session authenticated) {
        ConnectionState previous;
        lock.lock();
        try {
            previous = state.get();
            if (epoch != attemptEpoch
                    || (previous != ConnectionState.CONNECTED && previous != ConnectionState.AUTHENTICATING)) {
                log.debug("Discarding authentication result from a superseded connection");
                return;
            }
            session = authenticated;
            wasAuthenticated = true;
            reconnectAttempts = 0;
            state.set(ConnectionState.READY);
        } finally {
            lock.unlock();
        }

        persistSession(authenticated);
        log.info("Session {} authenticated via {}, connection READY", authenticated.getId(), authenticated.getAuthMethod());
        events.publishAuthenticated(this, authenticated.getAuthMethod(), authenticated.getId());
        events.publishReady(this, previous);
        notifyListeners(previous, ConnectionState.READY);
    }

    private void onAuthFailed(long attemptEpoch, Throwable error, AuthMethod method) {
        if (error instanceof AuthenticationException authError && authError.getErrorCode() == ErrorCode.AUTH_CANCELLED) {
            return;
        }
        ConnectionState previous;
        lock.lock();
        try {
            previous = state.get();
            if (epoch != attemptEpoch
                    || (previous != ConnectionState.CONNECTED && previous != ConnectionState.AUTHENTICATING)) {
                return;
            }
            state.set(ConnectionState.CONNECTED);
            if (method == AuthMethod.RESTORE) {
                session = freshSession();
            }
        } finally {
            lock.unlock();
        }

        ChatPulseException failure = error instanceof ChatPulseException known
                ? known
                : new AuthenticationException(ErrorCode.AUTH_REJECTED, describe(error), error);
        log.warn("{} authentication failed: {}", method, failure.getMessage());
        events.publishError(this, failure);
        if (previous != ConnectionState.CONNECTED) {
            notifyListeners(previous, ConnectionState.CONNECTED);
        }

        if (method == AuthMethod.RESTORE) {
            log.info("Session restore failed, discarding stored session and starting a fresh flow");
            deleteStoredSession();
            startConfiguredFlow(attemptEpoch);
        } else if (method == AuthMethod.PAIRING && properties.getAuthStrategy() == AuthStrategy.AUTO) {
            log.info("Pairing failed under AUTO strategy, falling back to QR");
            try {
                startQrFlow(attemptEpoch);
            } catch (ChatPulseException e) {
                log.warn("Could not start QR fallback: {}", e.getMessage());
                events.publishError(this, e);
            }
        }
    }

    // ---- Connection loss and reconnect ----

    private void onHeartbeatStale() {
        handleConnectionLost(
                new ClientTimeoutException(
                        ErrorCode.HEARTBEAT_TIMEOUT,
                        "No pong received within " + properties.getHeartbeatIntervalMs()
                                * properties.getHeartbeatMissedThreshold() + "ms"),
                FailureCategory.NETWORK);
    }

    void handleConnectionLost(ChatPulseException error, FailureCategory category) {
        ConnectionState previous;
        ReconnectStep step = null;
        boolean invalidate;
        lock.lock();
        try {
            previous = state.get();
            if (!previous.isLive()) {
                log.debug("Ignoring connection loss while {}", previous);
                return;
            }
            epoch++;
            cancelTimersLocked();
            state.set(ConnectionState.DISCONNECTED);
            invalidate = category == FailureCategory.AUTH;
            if (invalidate) {
                session = freshSession();
            }
            if (properties.isAutoReconnect() && wasAuthenticated) {
                step = scheduleReconnectLocked();
            }
        } finally {
            lock.unlock();
        }

        heartbeat.stop();
        authFlow.cancel();
        transport.close();
        log.warn("Connection lost while {}: {} (category={})", previous, error.getMessage(), category);
        if (invalidate) {
            deleteStoredSession();
        }
        events.publishDisconnected(this, previous, error.getMessage());
        events.publishError(this, error);
        notifyListeners(previous, ConnectionState.DISCONNECTED);
        if (step != null) {
            log.info("Reconnect attempt {} scheduled in {}ms", step.attempt(), step.delay().toMillis());
            events.publishReconnecting(this, step.attempt(), step.delay());
            notifyListeners(ConnectionState.DISCONNECTED, ConnectionState.RECONNECTING);
        }
    }

    /** Moves to RECONNECTING and arms the backoff timer. Caller holds the lock. */
    private ReconnectStep scheduleReconnectLocked() {
        Duration delay = reconnectPolicy.delayFor(reconnectAttempts);
        long expectedEpoch = epoch;
        state.set(ConnectionState.RECONNECTING);
        reconnectTimer = context.getScheduler()
                .schedule(() -> attemptReconnect(expectedEpoch), context.now().plus(delay));
        return new ReconnectStep(reconnectAttempts + 1, delay);
    }

    private void attemptReconnect(long expectedEpoch) {
        long attemptEpoch;
        int attempt;
        lock.lock();
        try {
            if (epoch != expectedEpoch || state.get() != ConnectionState.RECONNECTING) {
                return;
            }
            reconnectTimer = null;
            attemptEpoch = ++epoch;
            attempt = reconnectAttempts + 1;
        } finally {
            lock.unlock();
        }
        log.info("Reconnect attempt {}/{}", attempt, reconnectPolicy.getMaxAttempts());
        openTransport(attemptEpoch);
    }

    private void cancelTimersLocked() {
        if (openTimer != null) {
            openTimer.cancel(false);
            openTimer = null;
        }
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    // ---- Session persistence ----

    private Optional<Session> loadStoredSession() {
        try {
            return sessionStore.load(properties.getSessionName()).map(sessionCodec::decode);
        } catch (RuntimeException e) {
            SessionStoreException failure = storeFailure("read", e);
            log.warn("Ignoring unreadable stored session: {}", failure.getMessage());
            events.publishError(this, failure);
            return Optional.empty();
        }
    }

    private void persistSession(Session authenticated) {
        try {
            sessionStore.save(properties.getSessionName(), sessionCodec.encode(authenticated));
        } catch (RuntimeException e) {
            SessionStoreException failure = storeFailure("write", e);
            log.warn("Failed to persist session {}: {}", authenticated.getId(), failure.getMessage());
            events.publishError(this, failure);
        }
    }

    private void deleteStoredSession() {
        try {
            sessionStore.delete(properties.getSessionName());
        } catch (RuntimeException e) {
            log.warn("Failed to delete stored session: {}", storeFailure("delete", e).getMessage());
        }
    }

    /** Pluggable stores may break their contract; any failure is reported as a store error. */
    private static SessionStoreException storeFailure(String action, RuntimeException e) {
        return e instanceof SessionStoreException storeError
                ? storeError
                : new SessionStoreException("Session store failed to " + action + ": " + e, e);
    }

    // ---- Helpers ----

    private Session freshSession() {
        return Session.builder()
                .id(UUID.randomUUID().toString())
                .authenticated(false)
                .createdAt(context.now())
                .build();
    }

    private void notifyListeners(ConnectionState previous, ConnectionState current) {
        for (ConnectionStateListener listener : stateListeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (RuntimeException e) {
                log.error("State listener failed on {} -> {}: {}", previous, current, e.getMessage(), e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record ReconnectStep(int attempt, Duration delay) {}
}
