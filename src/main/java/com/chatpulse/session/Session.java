package com.chatpulse.session;

import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client session as known locally. An unauthenticated instance exists from construction;
 * a successful auth flow replaces it with one carrying the server token and expiry,
 * which is what gets persisted for later restore.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;
    private boolean authenticated;
    private AuthMethod authMethod;
    private Instant createdAt;
    private Instant connectedAt;
    private Instant expiresAt;

    /** Opaque credential issued by the server; sent back on restore. */
    private String token;

    private String phoneNumber;
    private Map<String, String> clientInfo;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /** True when this session can be offered to the server for a restore round trip. */
    public boolean isRestorable(Instant now) {
        return authenticated && token != null && !isExpired(now);
    }
}
