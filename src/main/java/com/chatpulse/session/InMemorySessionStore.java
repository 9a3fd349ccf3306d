package com.chatpulse.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Volatile store for tests and for clients that should never persist credentials. */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String name) {
        return blobs.containsKey(name);
    }

    @Override
    public Optional<byte[]> load(String name) {
        byte[] blob = blobs.get(name);
        return blob == null ? Optional.empty() : Optional.of(blob.clone());
    }

    @Override
    public void save(String name, byte[] blob) {
        blobs.put(name, blob.clone());
    }

    @Override
    public void delete(String name) {
        blobs.remove(name);
    }
}
