package com.tandem.dispatch.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public SlidingWindowRateLimiter toolRateLimiter(RateLimitProperties properties, Clock clock) {
        log.info("Tool rate limit: {} requests per {}s (enabled={})",
                properties.getMaxRequests(), properties.getWindowSeconds(), properties.isEnabled());
        return new SlidingWindowRateLimiter(properties.getMaxRequests(),
                Duration.ofSeconds(properties.getWindowSeconds()), clock);
    }
}
