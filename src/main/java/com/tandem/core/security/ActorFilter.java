package com.tandem.core.security;

import com.tandem.core.logging.MdcContext;
import com.tandem.core.model.Actor;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the calling actor for every API request and exposes it as the
 * {@value #ACTOR_ATTRIBUTE} request attribute.
 */
@Component
@Order(1)
public class ActorFilter implements Filter {

    public static final String ACTOR_ATTRIBUTE = "tandem.actor";

    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/v1/health",
            "/actuator/health",
            "/actuator/prometheus"
    );

    private final AuthProperties authProperties;
    private final ActorResolver actorResolver;

    public ActorFilter(AuthProperties authProperties, ActorResolver actorResolver) {
        this.authProperties = authProperties;
        this.actorResolver = actorResolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String path = httpRequest.getRequestURI();

        if (PUBLIC_PATHS.contains(path) || !path.startsWith("/api/")) {
            chain.doFilter(request, response);
            return;
        }

        Optional<Actor> actor = authProperties.isEnabled()
                ? actorResolver.resolve(httpRequest.getHeader("Authorization"))
                : Optional.of(new Actor(authProperties.getDevUserId(), authProperties.getDevUserName()));

        if (actor.isEmpty()) {
            httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            httpResponse.setContentType("application/json");
            httpResponse.getWriter().write("{\"error\":\"Authentication required\"}");
            return;
        }

        httpRequest.setAttribute(ACTOR_ATTRIBUTE, actor.get());
        MdcContext.setActor(actor.get().userId());
        try {
            chain.doFilter(request, response);
        } finally {
            MdcContext.clear();
        }
    }
}
