package com.adlanda.mediphant.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter keyed by client identity.
 *
 * Each key gets {@code capacity} requests per window; the window starts with the first
 * request after the previous one expired. Per-key evaluation is atomic, and the
 * sweeper removes an entry only while holding that key, so a request being evaluated
 * never loses its entry.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final int DEFAULT_CAPACITY = 100;

    private final Map<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
    private final Duration window;
    private final int capacity;
    private final Clock clock;

    public RateLimiter(Duration window, int capacity, Clock clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.window = window;
        this.capacity = capacity;
        this.clock = clock;
    }

    public RateLimiter(Clock clock) {
        this(DEFAULT_WINDOW, DEFAULT_CAPACITY, clock);
    }

    /**
     * Counts a request for the key and reports whether it is admitted.
     * A denied request leaves the entry untouched.
     */
    public boolean isAllowed(String key) {
        Instant now = clock.instant();
        boolean[] allowed = new boolean[1];
        entries.compute(key, (k, entry) -> {
            if (entry == null || entry.isExpired(now)) {
                allowed[0] = true;
                return new RateLimitEntry(1, now.plus(window));
            }
            if (entry.count() >= capacity) {
                allowed[0] = false;
                return entry;
            }
            allowed[0] = true;
            return entry.increment();
        });
        return allowed[0];
    }

    /**
     * Requests the key may still make in its current window.
     */
    public int remaining(String key) {
        RateLimitEntry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return capacity;
        }
        return Math.max(0, capacity - entry.count());
    }

    /**
     * Time until the key's window resets, rounded up to whole seconds and at least one second.
     */
    public Duration retryAfter(String key) {
        Instant now = clock.instant();
        RateLimitEntry entry = entries.get(key);
        Duration wait = entry == null || entry.isExpired(now)
                ? window
                : Duration.between(now, entry.windowResetAt());
        long seconds = Math.max(1, (wait.toMillis() + 999) / 1000);
        return Duration.ofSeconds(seconds);
    }

    /**
     * Drops every entry whose window has passed.
     *
     * @return Number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (String key : entries.keySet()) {
            boolean[] expired = new boolean[1];
            entries.computeIfPresent(key, (k, entry) -> {
                expired[0] = entry.isExpired(now);
                return expired[0] ? null : entry;
            });
            if (expired[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired rate limit entries", removed);
        }
        return removed;
    }

    public int trackedKeys() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getWindow() {
        return window;
    }
}
