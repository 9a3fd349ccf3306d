package com.chatpulse.transport;

import com.chatpulse.exception.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** JSON text encoding of {@link Envelope}s for text-frame transports. */
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to encode envelope of type " + envelope.getType(), e);
        }
    }

    public Envelope decode(String text) {
        Envelope envelope;
        try {
            envelope = objectMapper.readValue(text, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed envelope: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || envelope.getType() == null || envelope.getType().isBlank()) {
            throw new TransportException("Envelope without type");
        }
        return envelope;
    }
}
