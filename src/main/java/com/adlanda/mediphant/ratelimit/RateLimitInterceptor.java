package com.adlanda.mediphant.ratelimit;

import com.adlanda.mediphant.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the shared rate limiter to every API request before it reaches a controller.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final RateLimiter rateLimiter;
    private final boolean trustForwardedHeaders;

    /**
     * @param rateLimiter           Shared limiter
     * @param trustForwardedHeaders Whether proxy headers identify the client
     */
    public RateLimitInterceptor(RateLimiter rateLimiter, boolean trustForwardedHeaders) {
        this.rateLimiter = rateLimiter;
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String clientKey = clientKey(request);
        if (!rateLimiter.isAllowed(clientKey)) {
            log.debug("Rate limit exceeded for client {}", clientKey);
            throw new RateLimitExceededException(rateLimiter.retryAfter(clientKey));
        }
        response.setHeader(LIMIT_HEADER, String.valueOf(rateLimiter.getCapacity()));
        response.setHeader(REMAINING_HEADER, String.valueOf(rateLimiter.remaining(clientKey)));
        return true;
    }

    /**
     * Identifies the client by the first forwarded address, then the real-IP header,
     * then the socket peer. Proxy headers are ignored unless trusted.
     */
    String clientKey(HttpServletRequest request) {
        if (!trustForwardedHeaders) {
            return remoteAddress(request);
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return remoteAddress(request);
    }

    private static String remoteAddress(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return remote != null ? remote : "unknown";
    }
}
