package com.chatpulse.ratelimit;

import com.chatpulse.config.ChatPulseProperties;
import com.chatpulse.config.ClientContext;
import com.chatpulse.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window admission control keyed by (identifier, action).
 *
 * <p>A check evaluates the burst, minute, hour and day windows in that order. The first
 * window at or over its cap rejects the call with a {@link RateLimitException} carrying the
 * time until that window's oldest entry ages out. Only a call that passes every window is
 * recorded, and it is recorded into all of them. Rejected calls leave no trace, so a client
 * hammering a full window cannot push its own recovery further out.
 *
 * <p>Check-then-record runs inside {@link ConcurrentHashMap#compute}, which makes it atomic
 * per key without a global lock. Read-only projections use {@code computeIfPresent} with an
 * identity remapping for the same reason and never evict.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final ClientContext context;
    private final Map<RateWindowType, Integer> limits = new EnumMap<>(RateWindowType.class);
    private final ConcurrentHashMap<RateKey, KeyWindows> windows = new ConcurrentHashMap<>();
    private final long cleanupIntervalMs;

    private final AtomicLong admitted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private volatile boolean enabled;
    private volatile ScheduledFuture<?> cleanupTask;

    public RateLimiter(ClientContext context) {
        this.context = context;
        ChatPulseProperties.RateLimits config = context.getProperties().getRateLimits();
        limits.put(RateWindowType.BURST, config.getBurst());
        limits.put(RateWindowType.MINUTE, config.getPerMinute());
        limits.put(RateWindowType.HOUR, config.getPerHour());
        limits.put(RateWindowType.DAY, config.getPerDay());
        this.cleanupIntervalMs = config.getCleanupIntervalMs();
        this.enabled = config.isEnabled();
    }

    /**
     * Admits one call for the key or throws.
     *
     * @throws RateLimitException when any enabled window is at its cap
     */
    public void checkLimit(String identifier, String action) {
        if (!enabled) {
            return;
        }
        RateKey key = new RateKey(identifier, action);
        long now = context.nowMillis();
        RateLimitException[] rejection = new RateLimitException[1];

        windows.compute(key, (k, existing) -> {
            KeyWindows keyWindows = existing != null ? existing : new KeyWindows(limits);
            rejection[0] = keyWindows.tryAcquire(k.describe(), now);
            return keyWindows;
        });

        if (rejection[0] != null) {
            rejected.incrementAndGet();
            log.debug("Rate limit hit: key={}, window={}", key, rejection[0].getWindow());
            throw rejection[0];
        }
        admitted.incrementAndGet();
    }

    /** Live entries per enabled window. Empty for keys never seen. */
    public Map<RateWindowType, Integer> getUsage(String identifier, String action) {
        long now = context.nowMillis();
        Map<RateWindowType, Integer> usage = new EnumMap<>(RateWindowType.class);
        windows.computeIfPresent(new RateKey(identifier, action), (k, keyWindows) -> {
            for (RateWindow window : keyWindows.windows) {
                usage.put(window.type(), window.countLive(now));
            }
            return keyWindows;
        });
        return usage;
    }

    /** Calls still admissible per enabled window. */
    public Map<RateWindowType, Integer> getRemaining(String identifier, String action) {
        Map<RateWindowType, Integer> usage = getUsage(identifier, action);
        Map<RateWindowType, Integer> remaining = new EnumMap<>(RateWindowType.class);
        limits.forEach((type, limit) -> {
            if (limit > 0) {
                remaining.put(type, Math.max(0, limit - usage.getOrDefault(type, 0)));
            }
        });
        return remaining;
    }

    /** Starts the periodic sweep that drops keys whose windows have all drained. */
    public void startCleanup() {
        if (cleanupTask != null) {
            return;
        }
        Duration interval = Duration.ofMillis(cleanupIntervalMs);
        cleanupTask = context.getScheduler()
                .scheduleAtFixedRate(this::cleanup, context.now().plus(interval), interval);
        log.debug("Rate limiter cleanup scheduled every {}ms", cleanupIntervalMs);
    }

    public void stop() {
        ScheduledFuture<?> task = cleanupTask;
        cleanupTask = null;
        if (task != null) {
            task.cancel(false);
        }
    }

    /** Evicts expired timestamps everywhere and removes keys left empty. */
    public void cleanup() {
        long now = context.nowMillis();
        List<RateKey> keys = new ArrayList<>(windows.keySet());
        int before = keys.size();
        for (RateKey key : keys) {
            windows.computeIfPresent(key, (k, keyWindows) -> keyWindows.evictAll(now) ? null : keyWindows);
        }
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Rate limiter cleanup removed {} idle keys, {} remain", removed, windows.size());
        }
    }

    public void reset(String identifier, String action) {
        windows.remove(new RateKey(identifier, action));
    }

    public void clear() {
        windows.clear();
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Rate limiting {}", enabled ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RateLimiterStats getStats() {
        return RateLimiterStats.builder()
                .enabled(enabled)
                .activeKeys(windows.size())
                .admitted(admitted.get())
                .rejected(rejected.get())
                .build();
    }

    /** Window owner. Identifier and action stay separate so no two pairs can share windows. */
    private record RateKey(String identifier, String action) {

        String describe() {
            return identifier + "/" + action;
        }
    }

    /** All enabled windows for one key. */
    private static final class KeyWindows {

        private final List<RateWindow> windows = new ArrayList<>(RateWindowType.values().length);

        KeyWindows(Map<RateWindowType, Integer> limits) {
            for (RateWindowType type : RateWindowType.values()) {
                Integer limit = limits.get(type);
                if (limit != null && limit > 0) {
                    windows.add(new RateWindow(type, limit));
                }
            }
        }

        RateLimitException tryAcquire(String key, long now) {
            for (RateWindow window : windows) {
                window.evict(now);
                if (window.isFull()) {
                    return new RateLimitException(
                            key,
                            window.type().getLabel(),
                            window.limit(),
                            Duration.ofMillis(window.retryAfterMs(now)));
                }
            }
            for (RateWindow window : windows) {
                window.record(now);
            }
            return null;
        }

        /** Returns true when nothing live remains. */
        boolean evictAll(long now) {
            boolean empty = true;
            for (RateWindow window : windows) {
                window.evict(now);
                empty &= window.isEmpty();
            }
            return empty;
        }
    }
}
