package com.adlanda.mediphant.exception;

import java.time.Duration;

/**
 * Thrown when a client has used up its request allowance for the current window.
 */
public class RateLimitExceededException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitExceededException(Duration retryAfter) {
        super("Rate limit exceeded");
        this.retryAfter = retryAfter;
    }

    /**
     * Time until the client's window resets.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
