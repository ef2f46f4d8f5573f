package com.gatekeeper.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.config.GatekeeperProperties;
import com.gatekeeper.middleware.MiddlewareResponse;
import com.gatekeeper.middleware.RateLimitingMiddleware;
import com.gatekeeper.model.RequestDescriptor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single place requests are admitted or rejected. User id and tier come from the
 * authentication layer as request attributes, or from headers when it runs upstream.
 * The filter is ordered after the Spring Security filter chain so that those attributes
 * are already set, and after {@link RequestIdFilter} so rejections are logged with an id.
 */
@Slf4j
@Component
@Order(RateLimitingFilter.ORDER)
@ConditionalOnProperty(prefix = "gatekeeper.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitingFilter extends OncePerRequestFilter {

    public static final int ORDER = SecurityProperties.DEFAULT_FILTER_ORDER + 10;

    public static final String USER_ID_ATTRIBUTE = "gatekeeper.userId";
    public static final String TIER_ATTRIBUTE = "gatekeeper.tier";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String TIER_HEADER = "X-User-Tier";
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final RateLimitingMiddleware middleware;
    private final ObjectMapper objectMapper;
    private final GatekeeperProperties.Filter settings;

    public RateLimitingFilter(RateLimitingMiddleware middleware, ObjectMapper objectMapper,
                              GatekeeperProperties properties) {
        this.middleware = middleware;
        this.objectMapper = objectMapper;
        this.settings = properties.getFilter();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return settings.getExcludedPaths().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req,
            HttpServletResponse res,
            FilterChain chain)
            throws IOException, ServletException {

        MiddlewareResponse decision = middleware.process(extractDescriptor(req));
        decision.getHeaders().forEach(res::setHeader);

        if (decision.isAllowed()) {
            chain.doFilter(req, res);
            return;
        }

        log.debug("Rejecting {} {}: {}", req.getMethod(), req.getRequestURI(), decision.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", decision.getMessage());
        body.put("status", decision.getStatusCode());

        res.setStatus(decision.getStatusCode());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(res.getOutputStream(), body);
    }

    RequestDescriptor extractDescriptor(HttpServletRequest req) {
        return RequestDescriptor.builder()
                .ip(clientIp(req))
                .userId(attributeOrHeader(req, USER_ID_ATTRIBUTE, USER_ID_HEADER))
                .tier(attributeOrHeader(req, TIER_ATTRIBUTE, TIER_HEADER))
                .endpoint(req.getRequestURI())
                .build();
    }

    private String clientIp(HttpServletRequest req) {
        if (settings.isTrustForwardedFor()) {
            String forwarded = req.getHeader(FORWARDED_FOR_HEADER);
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return req.getRemoteAddr();
    }

    private static String attributeOrHeader(HttpServletRequest req, String attribute, String header) {
        Object value = req.getAttribute(attribute);
        if (value != null) {
            return value.toString();
        }
        return req.getHeader(header);
    }
}
