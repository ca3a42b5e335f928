package com.adlanda.mediphant.ratelimit;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired rate limit entries, independent of request traffic.
 */
@Component
public class RateLimiterSweeper {

    private final RateLimiter rateLimiter;

    public RateLimiterSweeper(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${faq.rate-limit.sweep-interval-ms:300000}",
            initialDelayString = "${faq.rate-limit.sweep-interval-ms:300000}")
    public void sweep() {
        rateLimiter.sweepExpired();
    }
}
