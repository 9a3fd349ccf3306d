package com.chatpulse.ratelimit;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Sliding window of admission timestamps for one key and one period.
 *
 * <p>Timestamps are appended in non-decreasing order, so eviction only ever looks at the
 * head. After {@link #evict(long)} every stored timestamp is {@code > now - size}.
 * Not thread-safe; the owning {@link RateLimiter} serializes access per key.
 */
class RateWindow {

    private final RateWindowType type;
    private final int limit;
    private final long sizeMs;
    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    RateWindow(RateWindowType type, int limit) {
        this.type = type;
        this.limit = limit;
        this.sizeMs = type.getSize().toMillis();
    }

    RateWindowType type() {
        return type;
    }

    int limit() {
        return limit;
    }

    void evict(long now) {
        long cutoff = now - sizeMs;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }

    boolean isFull() {
        return timestamps.size() >= limit;
    }

    /** Millis until the oldest timestamp ages out. Only meaningful when the window is non-empty. */
    long retryAfterMs(long now) {
        Long oldest = timestamps.peekFirst();
        return oldest == null ? 0 : Math.max(0, oldest + sizeMs - now);
    }

    void record(long now) {
        timestamps.addLast(now);
    }

    boolean isEmpty() {
        return timestamps.isEmpty();
    }

    /** Counts live timestamps without evicting anything. */
    int countLive(long now) {
        long cutoff = now - sizeMs;
        int live = 0;
        Iterator<Long> it = timestamps.descendingIterator();
        while (it.hasNext() && it.next() > cutoff) {
            live++;
        }
        return live;
    }
}
