package com.chatpulse.session;

import com.chatpulse.exception.SessionStoreException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/** Maps {@link Session} to and from the blob handed to the {@link SessionStore}. */
public class SessionCodec {

    private final ObjectMapper objectMapper;

    public SessionCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public SessionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Session session) {
        try {
            return objectMapper.writeValueAsBytes(session);
        } catch (IOException e) {
            throw new SessionStoreException("Failed to encode session " + session.getId(), e);
        }
    }

    public Session decode(byte[] blob) {
        try {
            return objectMapper.readValue(blob, Session.class);
        } catch (IOException e) {
            throw new SessionStoreException("Stored session is unreadable", e);
        }
    }
}
