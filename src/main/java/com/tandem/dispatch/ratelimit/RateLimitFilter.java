package com.tandem.dispatch.ratelimit;

import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.Actor;
import com.tandem.core.security.ActorFilter;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Applies the per-actor request limit to tool calls. Runs after {@link ActorFilter}.
 */
@Component
@Order(2)
public class RateLimitFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    private static final String TOOLS_PREFIX = "/api/v1/tools/";

    private final RateLimitProperties properties;
    private final SlidingWindowRateLimiter limiter;
    private final TandemMetrics metrics;

    public RateLimitFilter(RateLimitProperties properties, SlidingWindowRateLimiter limiter, TandemMetrics metrics) {
        this.properties = properties;
        this.limiter = limiter;
        this.metrics = metrics;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        Object actor = httpRequest.getAttribute(ActorFilter.ACTOR_ATTRIBUTE);
        if (!properties.isEnabled() || !httpRequest.getRequestURI().startsWith(TOOLS_PREFIX)
                || !(actor instanceof Actor)) {
            chain.doFilter(request, response);
            return;
        }

        String key = ((Actor) actor).ledgerTag();
        if (limiter.tryAcquire(key)) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Rate limit exceeded for {}", key);
        metrics.recordRateLimited();
        httpResponse.setStatus(429);
        httpResponse.setContentType("application/json");
        httpResponse.getWriter().write("{\"error\":\"Rate limit exceeded\",\"message\":\"Maximum "
                + limiter.getMaxRequests() + " requests per " + limiter.getWindow().toSeconds() + " seconds\"}");
    }

    @Scheduled(fixedDelayString = "${tandem.rate-limit.eviction-interval-ms:60000}")
    void evictIdleKeys() {
        int evicted = limiter.evictExpired();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit key(s)", evicted);
        }
    }
}
