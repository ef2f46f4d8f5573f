package com.gatekeeper.middleware;

import com.gatekeeper.dos.DosDetector;
import com.gatekeeper.model.RateLimitResult;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.model.RequestDescriptor;
import com.gatekeeper.service.MetricsService;
import com.gatekeeper.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Framework-neutral admission stage: DoS screen first, then the rate limits, then the
 * informational headers. Whatever happens inside, the caller gets a decision back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitingMiddleware {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public static final String DOS_MESSAGE = "DoS attack detected";
    private static final String DEFAULT_ENDPOINT = "/";

    private final DosDetector dosDetector;
    private final RateLimiterService rateLimiterService;
    private final MetricsService metricsService;

    public MiddlewareResponse process(RequestDescriptor request) {
        RequestDescriptor descriptor = normalize(request);
        AdmissionStage stage = AdmissionStage.RECEIVED;
        try {
            stage = AdmissionStage.DOS_CHECK;
            String ip = descriptor.getIp();
            if (ip != null && dosDetector.isAttack(ip)) {
                metricsService.recordDosBlock();
                Map<String, String> headers = new LinkedHashMap<>();
                headers.put(HEADER_RETRY_AFTER, String.valueOf(dosDetector.banRemainingSeconds(ip)));
                log.warn("Request from ip={} to {} blocked by DoS screen", ip, descriptor.getEndpoint());
                return finish(AdmissionStage.BLOCKED, MiddlewareResponse.blocked(DOS_MESSAGE, headers));
            }

            stage = AdmissionStage.RATE_CHECK;
            RateLimitResult result = rateLimiterService.isAllowed(descriptor);
            Optional<RateLimitStatus> status = rateLimiterService.currentStatus(descriptor);
            Map<String, String> headers = headersFor(status);

            if (!result.isAllowed()) {
                status.ifPresent(s -> headers.put(HEADER_RETRY_AFTER, String.valueOf(s.getResetSeconds())));
                String message = "Rate limit exceeded (" + result.getReason().label() + ")";
                return finish(AdmissionStage.BLOCKED, MiddlewareResponse.blocked(message, headers));
            }
            return finish(AdmissionStage.ALLOWED, MiddlewareResponse.allowed(headers));

        } catch (RuntimeException e) {
            log.error("Admission check failed during {} for {}; letting the request through", stage, descriptor, e);
            return MiddlewareResponse.allowed(Map.of());
        }
    }

    static Map<String, String> headersFor(Optional<RateLimitStatus> status) {
        Map<String, String> headers = new LinkedHashMap<>();
        status.ifPresent(s -> {
            headers.put(HEADER_LIMIT, String.valueOf(s.getLimit()));
            headers.put(HEADER_REMAINING, String.valueOf(s.getRemaining()));
            headers.put(HEADER_RESET, String.valueOf(s.getResetSeconds()));
        });
        return headers;
    }

    private MiddlewareResponse finish(AdmissionStage stage, MiddlewareResponse response) {
        log.debug("Admission {}: status={}, message={}", stage, response.getStatusCode(), response.getMessage());
        return response;
    }

    private static RequestDescriptor normalize(RequestDescriptor request) {
        return RequestDescriptor.builder()
                .ip(blankToNull(request.getIp()))
                .userId(blankToNull(request.getUserId()))
                .tier(request.getTier())
                .endpoint(request.getEndpoint() == null || request.getEndpoint().isBlank()
                        ? DEFAULT_ENDPOINT : request.getEndpoint())
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
