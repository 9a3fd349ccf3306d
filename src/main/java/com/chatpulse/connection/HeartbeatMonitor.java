package com.chatpulse.connection;

import com.chatpulse.config.ClientContext;
import com.chatpulse.exception.TransportException;
import com.chatpulse.transport.Transport;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pings on a fixed interval and declares the connection stale when no pong has arrived for
 * more than {@code interval * missedThreshold}. Catches half-open sockets that never raise
 * a read or write error.
 *
 * <p>The stale callback fires at most once per {@link #start()}.
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final ClientContext context;
    private final Transport transport;
    private final Duration interval;
    private final Duration staleAfter;
    private final Runnable onStale;

    private ScheduledFuture<?> task;
    private long generation;
    private volatile Instant lastPongAt;

    public HeartbeatMonitor(ClientContext context, Transport transport, Runnable onStale) {
        this.context = context;
        this.transport = transport;
        this.interval = Duration.ofMillis(context.getProperties().getHeartbeatIntervalMs());
        this.staleAfter = interval.multipliedBy(Math.max(1, context.getProperties().getHeartbeatMissedThreshold()));
        this.onStale = onStale;
    }

    public synchronized void start() {
        stopLocked();
        long current = ++generation;
        lastPongAt = context.now();
        task = context.getScheduler()
                .scheduleAtFixedRate(() -> beat(current), context.now().plus(interval), interval);
        log.debug("Heartbeat started: interval={}ms, staleAfter={}ms", interval.toMillis(), staleAfter.toMillis());
    }

    public synchronized void stop() {
        stopLocked();
    }

    public void recordPong() {
        lastPongAt = context.now();
    }

    public Instant getLastPongAt() {
        return lastPongAt;
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    private void beat(long expectedGeneration) {
        boolean stale;
        synchronized (this) {
            if (generation != expectedGeneration) {
                return;
            }
            Duration silence = Duration.between(lastPongAt, context.now());
            stale = silence.compareTo(staleAfter) > 0;
            if (stale) {
                stopLocked();
                log.warn("No pong for {}ms (limit {}ms), connection is stale", silence.toMillis(), staleAfter.toMillis());
            }
        }
        if (stale) {
            onStale.run();
        } else {
            sendPing();
        }
    }

    private void sendPing() {
        try {
            transport.ping();
        } catch (TransportException e) {
            log.warn("Heartbeat ping failed: {}", e.getMessage());
        }
    }

    private void stopLocked() {
        generation++;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
}
