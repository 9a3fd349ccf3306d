package com.chatpulse.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Duplex message channel to the service.
 *
 * <p>One logical connection at a time: {@link #open} replaces whatever was open before.
 * After a local {@link #close()} the transport reports nothing more for that connection,
 * so listeners only ever see remote closes and errors.
 */
public interface Transport {

    void setListener(TransportListener listener);

    /**
     * Starts opening the connection. The returned future completes when the channel is usable
     * or fails with the cause. The timeout is a hint for the underlying client; callers still
     * enforce their own deadline.
     */
    CompletableFuture<Void> open(URI uri, Map<String, String> headers, Duration timeout);

    /**
     * Sends one envelope.
     *
     * @throws com.chatpulse.exception.TransportException if the channel is closed or the write fails
     */
    void send(Envelope envelope);

    void ping();

    void close();

    boolean isOpen();
}
