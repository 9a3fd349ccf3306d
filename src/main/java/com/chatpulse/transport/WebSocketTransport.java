package com.chatpulse.transport;

import com.chatpulse.exception.TransportException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * {@link Transport} over a Spring {@link WebSocketClient}, carrying envelopes as JSON text frames.
 *
 * <p>Every {@link #open} and {@link #close} bumps a generation counter. Handler callbacks
 * belonging to an older generation are dropped, so a connection that was closed locally
 * or superseded never reports back to the listener.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator} because the queue
 * dispatcher and the heartbeat write from different threads.
 */
public class WebSocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    /** Tomcat client property bounding the handshake I/O. */
    static final String IO_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.IO_TIMEOUT_MS";

    private final WebSocketClient webSocketClient;
    private final EnvelopeCodec envelopeCodec;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    private final AtomicLong generation = new AtomicLong();

    private volatile TransportListener listener;
    private volatile WebSocketSession session;

    public WebSocketTransport(
            WebSocketClient webSocketClient, EnvelopeCodec envelopeCodec, int sendTimeLimitMs, int sendBufferSizeLimit) {
        this.webSocketClient = webSocketClient;
        this.envelopeCodec = envelopeCodec;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> open(URI uri, Map<String, String> headers, Duration timeout) {
        long openGeneration = generation.incrementAndGet();
        closeQuietly(session);
        session = null;

        WebSocketHttpHeaders httpHeaders = new WebSocketHttpHeaders();
        if (headers != null) {
            headers.forEach(httpHeaders::add);
        }
        if (webSocketClient instanceof StandardWebSocketClient standardClient) {
            standardClient.getUserProperties().put(IO_TIMEOUT_PROPERTY, String.valueOf(timeout.toMillis()));
        }

        log.info("Opening WebSocket connection to {}", uri);
        CompletableFuture<Void> result = new CompletableFuture<>();
        CompletableFuture<WebSocketSession> handshake =
                webSocketClient.execute(new GenerationHandler(openGeneration), httpHeaders, uri);

        // Cleanup hangs off the handshake itself: the caller may cancel or time out the
        // result future long before the server answers.
        handshake.whenComplete((rawSession, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            if (generation.get() != openGeneration || result.isDone()) {
                log.info("Discarding late WebSocket handshake: sessionId={}", rawSession.getId());
                discard(rawSession);
                result.completeExceptionally(new TransportException("Open superseded by a newer request"));
                return;
            }
            WebSocketSession decorated =
                    new ConcurrentWebSocketSessionDecorator(rawSession, sendTimeLimitMs, sendBufferSizeLimit);
            session = decorated;
            if (!result.complete(null)) {
                if (session == decorated) {
                    session = null;
                }
                discard(rawSession);
                return;
            }
            log.info("WebSocket connected: sessionId={}", rawSession.getId());
        });
        return result;
    }

    @Override
    public void send(Envelope envelope) {
        WebSocketSession current = requireOpen();
        try {
            current.sendMessage(new TextMessage(envelopeCodec.encode(envelope)));
        } catch (IOException | SessionLimitExceededException e) {
            throw new TransportException("Failed to send " + envelope.getType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ping() {
        WebSocketSession current = requireOpen();
        try {
            current.sendMessage(new PingMessage());
        } catch (IOException | SessionLimitExceededException e) {
            throw new TransportException("Failed to send ping: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        generation.incrementAndGet();
        WebSocketSession current = session;
        session = null;
        closeQuietly(current);
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    private WebSocketSession requireOpen() {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TransportException("WebSocket is not open");
        }
        return current;
    }

    private void closeQuietly(WebSocketSession target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", target.getId(), e.getMessage());
        }
    }

    /** Closes a session nobody owns, whatever state it reports. */
    private void discard(WebSocketSession target) {
        try {
            target.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Error closing discarded WebSocket session {}: {}", target.getId(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /** Routes frames to the listener while its generation is still current. */
    private class GenerationHandler extends TextWebSocketHandler {

        private final long handlerGeneration;

        GenerationHandler(long handlerGeneration) {
            this.handlerGeneration = handlerGeneration;
        }

        private TransportListener currentListener() {
            return generation.get() == handlerGeneration ? listener : null;
        }

        @Override
        protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
            TransportListener target = currentListener();
            if (target == null) {
                return;
            }
            Envelope envelope;
            try {
                envelope = envelopeCodec.decode(message.getPayload());
            } catch (TransportException e) {
                log.warn("Dropping inbound frame: {}", e.getMessage());
                return;
            }
            target.onMessage(envelope);
        }

        @Override
        protected void handlePongMessage(WebSocketSession wsSession, PongMessage message) {
            TransportListener target = currentListener();
            if (target != null) {
                target.onPong();
            }
        }

        @Override
        public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
            TransportListener target = currentListener();
            if (target != null) {
                log.warn("WebSocket transport error: {}", exception.getMessage());
                target.onError(exception);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
            TransportListener target = currentListener();
            if (target != null) {
                log.info("WebSocket closed by remote: code={}, reason={}", status.getCode(), status.getReason());
                target.onClose(status.getCode(), status.getReason());
            }
        }
    }
}
