package com.adlanda.mediphant.ratelimit;

import java.time.Instant;

/**
 * Request count of one client within its current window.
 *
 * @param count         Requests admitted so far in the window
 * @param windowResetAt Instant after which the window is over
 */
record RateLimitEntry(int count, Instant windowResetAt) {

    boolean isExpired(Instant now) {
        return now.isAfter(windowResetAt);
    }

    RateLimitEntry increment() {
        return new RateLimitEntry(count + 1, windowResetAt);
    }
}
