package com.chatpulse.auth;

import com.chatpulse.config.ChatPulseProperties;
import com.chatpulse.config.ClientContext;
import com.chatpulse.event.EventPublisherHelper;
import com.chatpulse.exception.AuthenticationException;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.TransportException;
import com.chatpulse.session.AuthMethod;
import com.chatpulse.session.Session;
import com.chatpulse.transport.Envelope;
import com.chatpulse.transport.EnvelopeTypes;
import com.chatpulse.transport.Transport;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the QR, pairing and session-restore protocols and owns the single active
 * {@link AuthChallenge}.
 *
 * <p>Each start method returns a future that completes with the authenticated
 * {@link Session}, or fails with an {@link AuthenticationException} (timeout, rejection,
 * exhausted attempts, cancellation). At most one flow is active: starting another cancels
 * the current one with {@code AUTH_CANCELLED}, and {@link #cancel()} stops every timer the
 * flow owns.
 *
 * <p>The handshake itself is opaque. This class only sends the request envelopes and
 * reacts to the server's {@code qr_update}, {@code pairing_code}, {@code auth_success}
 * and {@code auth_failure} envelopes, routed here by the connection manager.
 */
public class AuthFlow {

    private static final Logger log = LoggerFactory.getLogger(AuthFlow.class);

    private enum FlowType {
        QR,
        PAIRING,
        RESTORE
    }

    private final ClientContext context;
    private final Transport transport;
    private final EventPublisherHelper events;
    private final Duration authTimeout;
    private final Duration qrRefreshInterval;
    private final Duration restoreTimeout;
    private final Duration sessionTtl;
    private final int maxAttempts;

    private final ReentrantLock lock = new ReentrantLock();

    /** Guarded by {@link #lock}. Null when no flow is running. */
    private ActiveFlow active;

    public AuthFlow(ClientContext context, Transport transport) {
        this.context = context;
        this.transport = transport;
        this.events = context.getEvents();
        ChatPulseProperties properties = context.getProperties();
        this.authTimeout = Duration.ofMillis(properties.getAuthTimeoutMs());
        this.qrRefreshInterval = Duration.ofMillis(properties.getQrRefreshIntervalMs());
        this.restoreTimeout = Duration.ofMillis(properties.getRestoreTimeoutMs());
        this.sessionTtl = Duration.ofMillis(properties.getSessionTtlMs());
        this.maxAttempts = properties.getChallengeMaxAttempts();
    }

    // ---- Flow entry points ----

    /**
     * Requests a QR challenge. The payload is re-requested every refresh interval while the
     * challenge is pending; the flow fails with {@code AUTH_TIMEOUT} once the challenge expires.
     */
    public CompletableFuture<Session> startQr() {
        Instant now = context.now();
        AuthChallenge challenge = new AuthChallenge(ChallengeKind.QR, null, now, now.plus(authTimeout), maxAttempts);
        ActiveFlow flow = new ActiveFlow(FlowType.QR, challenge, null, null);

        ActiveFlow superseded;
        lock.lock();
        try {
            superseded = detachLocked();
            active = flow;
            flow.timers.add(context.getScheduler().schedule(() -> onChallengeExpired(flow), challenge.getExpiresAt()));
            flow.timers.add(context.getScheduler()
                    .scheduleAtFixedRate(() -> refreshQr(flow), now.plus(qrRefreshInterval), qrRefreshInterval));
        } finally {
            lock.unlock();
        }
        settleSuperseded(superseded);

        log.info("QR authentication started: challenge={}, expiresAt={}", challenge.getId(), challenge.getExpiresAt());
        sendRequest(flow, EnvelopeTypes.QR_REQUEST, Map.of("challengeId", challenge.getId()));
        return flow.future;
    }

    /**
     * Requests a pairing code for the given phone number. No refresh: the code is valid
     * until the challenge expires.
     *
     * @throws com.chatpulse.exception.ValidationException if the phone number is malformed
     */
    public CompletableFuture<Session> startPairing(String phoneNumber) {
        String digits = PhoneNumberValidator.normalize(phoneNumber);
        Instant now = context.now();
        AuthChallenge challenge =
                new AuthChallenge(ChallengeKind.PAIRING, null, now, now.plus(authTimeout), maxAttempts);
        ActiveFlow flow = new ActiveFlow(FlowType.PAIRING, challenge, null, digits);

        ActiveFlow superseded;
        lock.lock();
        try {
            superseded = detachLocked();
            active = flow;
            flow.timers.add(context.getScheduler().schedule(() -> onChallengeExpired(flow), challenge.getExpiresAt()));
        } finally {
            lock.unlock();
        }
        settleSuperseded(superseded);

        log.info("Pairing authentication started: challenge={}, phone=***{}", challenge.getId(), lastDigits(digits));
        sendRequest(
                flow,
                EnvelopeTypes.PAIRING_REQUEST,
                Map.of("challengeId", challenge.getId(), "phoneNumber", digits));
        return flow.future;
    }

    /**
     * Offers a stored session to the server. Completes with the refreshed session on
     * {@code auth_success}; fails on {@code auth_failure} or when no answer arrives in time.
     */
    public CompletableFuture<Session> restore(Session stored) {
        ActiveFlow flow = new ActiveFlow(FlowType.RESTORE, null, stored, stored.getPhoneNumber());
        Instant deadline = context.now().plus(restoreTimeout);

        ActiveFlow superseded;
        lock.lock();
        try {
            superseded = detachLocked();
            active = flow;
            flow.timers.add(context.getScheduler().schedule(() -> onRestoreTimeout(flow), deadline));
        } finally {
            lock.unlock();
        }
        settleSuperseded(superseded);

        log.info("Restoring session {}", stored.getId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", stored.getId());
        data.put("token", stored.getToken());
        sendRequest(flow, EnvelopeTypes.SESSION_RESTORE, data);
        return flow.future;
    }

    /** Stops the active flow, if any, and fails its future with {@code AUTH_CANCELLED}. */
    public void cancel() {
        ActiveFlow cancelled;
        lock.lock();
        try {
            cancelled = detachLocked();
        } finally {
            lock.unlock();
        }
        if (cancelled != null) {
            log.info("Authentication flow {} cancelled", cancelled.type);
            cancelled.future.completeExceptionally(
                    new AuthenticationException(ErrorCode.AUTH_CANCELLED, "Authentication cancelled"));
        }
    }

    public boolean isActive() {
        lock.lock();
        try {
            return active != null;
        } finally {
            lock.unlock();
        }
    }

    /** The pending challenge, for diagnostics. Empty while idle or restoring. */
    public Optional<AuthChallenge> getActiveChallenge() {
        lock.lock();
        try {
            return active == null ? Optional.empty() : Optional.ofNullable(active.challenge);
        } finally {
            lock.unlock();
        }
    }

    // ---- Inbound envelopes ----

    public void onQrUpdate(Envelope envelope) {
        String payload = envelope.dataString("qr");
        Instant expiresAt;
        lock.lock();
        try {
            if (!isPendingLocked(FlowType.QR)) {
                log.debug("Ignoring qr_update without a pending QR challenge");
                return;
            }
            active.challenge.updatePayload(payload);
            expiresAt = active.challenge.getExpiresAt();
        } finally {
            lock.unlock();
        }
        events.publishQrGenerated(this, payload, expiresAt);
    }

    public void onPairingCode(Envelope envelope) {
        String code = envelope.dataString("code");
        Instant expiresAt;
        lock.lock();
        try {
            if (!isPendingLocked(FlowType.PAIRING)) {
                log.debug("Ignoring pairing_code without a pending pairing challenge");
                return;
            }
            active.challenge.updatePayload(code);
            expiresAt = active.challenge.getExpiresAt();
        } finally {
            lock.unlock();
        }
        log.info("Pairing code received, expires at {}", expiresAt);
        events.publishPairingCode(this, code, expiresAt);
    }

    /**
     * Out-of-band acceptance. For a challenge flow, a {@code code} in the envelope is verified
     * against the challenge; without one the server signal is taken as the scan of the
     * current payload. A wrong code is reported and the flow keeps waiting until attempts run out.
     */
    public void onAuthSuccess(Envelope envelope) {
        Instant now = context.now();
        ActiveFlow settled = null;
        Session session = null;
        AuthenticationException rejection = null;

        lock.lock();
        try {
            ActiveFlow flow = active;
            if (flow == null) {
                log.debug("Ignoring auth_success with no active flow");
                return;
            }
            if (flow.type == FlowType.RESTORE) {
                session = restoredSession(flow.restoring, envelope, now);
                settled = detachLocked();
            } else {
                String response = envelope.dataString("code");
                if (response == null) {
                    response = flow.challenge.getPayload();
                }
                try {
                    flow.challenge.verify(response, now);
                    session = newSession(flow, envelope, now);
                    settled = detachLocked();
                } catch (AuthenticationException e) {
                    if (e.getErrorCode() == ErrorCode.CHALLENGE_NOT_PENDING) {
                        return;
                    }
                    if (e.getErrorCode() == ErrorCode.INVALID_CODE && flow.challenge.isExhausted()) {
                        rejection = new AuthenticationException(ErrorCode.MAX_ATTEMPTS_EXCEEDED, e.getMessage());
                        settled = detachLocked();
                    } else {
                        rejection = e;
                        if (e.getErrorCode() != ErrorCode.INVALID_CODE) {
                            settled = detachLocked();
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        if (session != null) {
            log.info("Authenticated via {}: session={}", session.getAuthMethod(), session.getId());
            settled.future.complete(session);
        } else if (settled != null) {
            log.warn("Authentication failed: {}", rejection.getMessage());
            settled.future.completeExceptionally(rejection);
        } else {
            log.warn("Authentication code rejected: {}", rejection.getMessage());
            events.publishError(this, rejection);
        }
    }

    public void onAuthFailure(Envelope envelope) {
        String reason = envelope.dataString("reason");
        ActiveFlow flow;
        lock.lock();
        try {
            flow = detachLocked();
        } finally {
            lock.unlock();
        }
        if (flow == null) {
            log.debug("Ignoring auth_failure with no active flow");
            return;
        }
        log.warn("Server rejected {} authentication: {}", flow.type, reason);
        flow.future.completeExceptionally(new AuthenticationException(
                ErrorCode.AUTH_REJECTED, "Authentication rejected: " + (reason != null ? reason : "unknown")));
    }

    // ---- Timers ----

    private void refreshQr(ActiveFlow flow) {
        String challengeId;
        lock.lock();
        try {
            if (active != flow || !flow.challenge.isPending()) {
                return;
            }
            challengeId = flow.challenge.getId();
        } finally {
            lock.unlock();
        }
        log.debug("Refreshing QR challenge {}", challengeId);
        sendRequest(flow, EnvelopeTypes.QR_REQUEST, Map.of("challengeId", challengeId, "refresh", true));
    }

    private void onChallengeExpired(ActiveFlow flow) {
        lock.lock();
        try {
            if (active != flow) {
                return;
            }
            flow.challenge.expire();
            detachLocked();
        } finally {
            lock.unlock();
        }
        log.warn("{} challenge {} expired", flow.type, flow.challenge.getId());
        flow.future.completeExceptionally(new AuthenticationException(ErrorCode.AUTH_TIMEOUT, "timeout"));
    }

    private void onRestoreTimeout(ActiveFlow flow) {
        lock.lock();
        try {
            if (active != flow) {
                return;
            }
            detachLocked();
        } finally {
            lock.unlock();
        }
        log.warn("Session restore timed out after {}ms", restoreTimeout.toMillis());
        flow.future.completeExceptionally(
                new AuthenticationException(ErrorCode.AUTH_TIMEOUT, "Session restore timed out"));
    }

    // ---- Internals ----

    private void sendRequest(ActiveFlow flow, String type, Map<String, Object> data) {
        try {
            transport.send(Envelope.of(type, data, context.nowMillis()));
        } catch (TransportException e) {
            lock.lock();
            try {
                if (active != flow) {
                    return;
                }
                detachLocked();
            } finally {
                lock.unlock();
            }
            log.warn("Failed to send {}: {}", type, e.getMessage());
            flow.future.completeExceptionally(
                    new AuthenticationException(ErrorCode.AUTH_REJECTED, "Could not send " + type, e));
        }
    }

    private boolean isPendingLocked(FlowType type) {
        return active != null
                && active.type == type
                && active.challenge != null
                && active.challenge.isPending();
    }

    /** Clears the active flow, cancels its timers and its challenge. Caller holds the lock. */
    private ActiveFlow detachLocked() {
        ActiveFlow previous = active;
        active = null;
        if (previous != null) {
            previous.timers.forEach(timer -> timer.cancel(false));
            previous.timers.clear();
            if (previous.challenge != null) {
                previous.challenge.cancel();
            }
        }
        return previous;
    }

    private void settleSuperseded(ActiveFlow superseded) {
        if (superseded != null) {
            log.info("Authentication flow {} superseded", superseded.type);
            superseded.future.completeExceptionally(
                    new AuthenticationException(ErrorCode.AUTH_CANCELLED, "Superseded by a new authentication flow"));
        }
    }

    private Session newSession(ActiveFlow flow, Envelope envelope, Instant now) {
        String sessionId = envelope.dataString("sessionId");
        return Session.builder()
                .id(sessionId != null ? sessionId : UUID.randomUUID().toString())
                .authenticated(true)
                .authMethod(flow.type == FlowType.QR ? AuthMethod.QR : AuthMethod.PAIRING)
                .createdAt(now)
                .connectedAt(now)
                .expiresAt(expiresAt(envelope, now.plus(sessionTtl)))
                .token(envelope.dataString("token"))
                .phoneNumber(flow.phoneNumber)
                .clientInfo(clientInfo(envelope))
                .build();
    }

    private Session restoredSession(Session stored, Envelope envelope, Instant now) {
        String token = envelope.dataString("token");
        return stored.toBuilder()
                .authenticated(true)
                .authMethod(AuthMethod.RESTORE)
                .connectedAt(now)
                .token(token != null ? token : stored.getToken())
                .expiresAt(expiresAt(envelope, stored.getExpiresAt()))
                .build();
    }

    private static Instant expiresAt(Envelope envelope, Instant fallback) {
        Long millis = envelope.dataLong("expiresAt");
        return millis != null ? Instant.ofEpochMilli(millis) : fallback;
    }

    private static Map<String, String> clientInfo(Envelope envelope) {
        Map<String, String> info = new LinkedHashMap<>();
        if (envelope.getData() != null && envelope.getData().get("clientInfo") instanceof Map<?, ?> raw) {
            raw.forEach((key, value) -> info.put(String.valueOf(key), String.valueOf(value)));
        }
        return info;
    }

    private static String lastDigits(String digits) {
        return digits.substring(Math.max(0, digits.length() - 4));
    }

    /** One running flow with the timers it owns. */
    private static final class ActiveFlow {

        private final FlowType type;
        private final AuthChallenge challenge;
        private final Session restoring;
        private final String phoneNumber;
        private final CompletableFuture<Session> future = new CompletableFuture<>();
        private final List<ScheduledFuture<?>> timers = new ArrayList<>();

        private ActiveFlow(FlowType type, AuthChallenge challenge, Session restoring, String phoneNumber) {
            this.type = type;
            this.challenge = challenge;
            this.restoring = restoring;
            this.phoneNumber = phoneNumber;
        }
    }
}
