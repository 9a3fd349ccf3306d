package com.chatpulse.event;

import com.chatpulse.transport.Envelope;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/** An inbound envelope that is not a connection or auth control message, handed to the application. */
public class InboundMessageEvent extends ApplicationEvent {

    private final Envelope envelope;
    private final LocalDateTime receivedAt;

    public InboundMessageEvent(Object source, Envelope envelope) {
        super(source);
        this.envelope = envelope;
        this.receivedAt = LocalDateTime.now();
    }

    public Envelope getEnvelope() {
        return envelope;
    }

    public LocalDateTime getReceivedAt() {
        return receivedAt;
    }
}
