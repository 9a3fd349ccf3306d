package com.chatpulse.event;

import com.chatpulse.session.AuthMethod;
import java.time.Instant;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the authentication flows.
 *
 * <p>For {@code QR_GENERATED} the {@code data} field holds the raw QR payload to render; for
 * {@code PAIRING_CODE} it holds the code the user types on their primary device. Both carry
 * the challenge {@code expiresAt}. {@code AUTHENTICATED} carries the session id and method.
 */
public class AuthEvent extends ApplicationEvent {

    private final AuthEventType eventType;
    private final String data;
    private final Instant expiresAt;
    private final AuthMethod authMethod;
    private final String sessionId;
    private final LocalDateTime occurredAt;

    public AuthEvent(
            Object source,
            AuthEventType eventType,
            String data,
            Instant expiresAt,
            AuthMethod authMethod,
            String sessionId) {
        super(source);
        this.eventType = eventType;
        this.data = data;
        this.expiresAt = expiresAt;
        this.authMethod = authMethod;
        this.sessionId = sessionId;
        this.occurredAt = LocalDateTime.now();
    }

    public AuthEventType getEventType() {
        return eventType;
    }

    public String getData() {
        return data;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public AuthMethod getAuthMethod() {
        return authMethod;
    }

    public String getSessionId() {
        return sessionId;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
