package com.gatekeeper.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation id, echoed in {@code X-Request-Id} and kept in
 * the MDC together with the route, so admission log lines can be traced back to a call.
 * Client-supplied ids are reused only when they are short and plain.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";
    public static final String MDC_ROUTE_KEY = "route";
    public static final String ATTRIBUTE = "gatekeeper.requestId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest req,
            HttpServletResponse res,
            FilterChain chain)
            throws IOException, ServletException {

        String id = resolveRequestId(req.getHeader(HEADER));
        req.setAttribute(ATTRIBUTE, id);
        res.setHeader(HEADER, id);

        MDC.put(MDC_KEY, id);
        MDC.put(MDC_ROUTE_KEY, req.getMethod() + " " + req.getRequestURI());
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_ROUTE_KEY);
        }
    }

    static String resolveRequestId(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
