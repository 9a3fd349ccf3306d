package com.chatpulse.session;

import java.util.Optional;

/**
 * Persists opaque session blobs by name. Encryption and at-rest format are the
 * implementation's concern; failures surface as
 * {@link com.chatpulse.exception.SessionStoreException}.
 */
public interface SessionStore {

    boolean exists(String name);

    Optional<byte[]> load(String name);

    void save(String name, byte[] blob);

    void delete(String name);

    /** Rejects a name this store cannot hold. Called once at startup for the configured name. */
    default void validateName(String name) {
    }
}
