package com.adlanda.mediphant.config;

import com.adlanda.mediphant.ratelimit.RateLimitInterceptor;
import com.adlanda.mediphant.ratelimit.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Puts every API endpoint behind the shared rate limiter.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final RateLimiter rateLimiter;
    private final boolean trustForwardedHeaders;

    /**
     * @param trustForwardedHeaders Identify clients by X-Forwarded-For / X-Real-IP. Turn off when
     *                              clients can reach the service without a proxy that overwrites them
     */
    public WebConfiguration(RateLimiter rateLimiter,
                            @Value("${faq.rate-limit.trust-forwarded-headers:true}") boolean trustForwardedHeaders) {
        this.rateLimiter = rateLimiter;
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RateLimitInterceptor(rateLimiter, trustForwardedHeaders))
                .addPathPatterns("/api", "/api/**");
    }
}
