package com.gatekeeper.controller;

import com.gatekeeper.config.GatekeeperProperties;
import com.gatekeeper.dto.AdmissionRequest;
import com.gatekeeper.dto.PolicySummary;
import com.gatekeeper.middleware.MiddlewareResponse;
import com.gatekeeper.middleware.RateLimitingMiddleware;
import com.gatekeeper.model.EndpointPolicy;
import com.gatekeeper.model.RateLimitStatus;
import com.gatekeeper.model.TierLimit;
import com.gatekeeper.policy.PolicyRegistry;
import com.gatekeeper.service.RateLimiterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/ratelimit")
@RequiredArgsConstructor
@Tag(name = "Rate Limiter", description = "Admission checks for host services")
public class RateLimitController {

    private final RateLimitingMiddleware middleware;
    private final RateLimiterService rateLimiterService;
    private final PolicyRegistry policyRegistry;
    private final GatekeeperProperties properties;

    @PostMapping("/check")
    @Operation(summary = "Check admission", description = "Run the DoS screen and rate limits for a request descriptor; consumes quota")
    public ResponseEntity<MiddlewareResponse> check(@Valid @RequestBody AdmissionRequest request) {
        log.debug("Admission check request: {}", request);
        MiddlewareResponse response = middleware.process(request.toDescriptor());

        ResponseEntity.BodyBuilder builder = response.isAllowed()
                ? ResponseEntity.ok()
                : ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().forEach(builder::header);
        return builder.body(response);
    }

    @GetMapping("/policies")
    @Operation(summary = "List policies", description = "Tier limits, endpoint policies and the IP policy loaded at startup")
    public ResponseEntity<PolicySummary> policies() {
        Map<String, String> tiers = new LinkedHashMap<>();
        for (TierLimit limit : policyRegistry.getTierLimits().values()) {
            tiers.put(limit.getTier(), limit.isUnlimited() ? "unlimited" : limit.getRequestsPerMinute() + " per minute");
        }

        List<PolicySummary.EndpointEntry> endpoints = policyRegistry.getEndpointPolicies().stream()
                .map(RateLimitController::toEntry)
                .toList();

        GatekeeperProperties.Ip ip = properties.getIp();
        return ResponseEntity.ok(PolicySummary.builder()
                .defaultTier(policyRegistry.getDefaultTier())
                .tiers(tiers)
                .endpoints(endpoints)
                .ip(new PolicySummary.IpEntry(ip.getMaxRequests(), ip.getWindow().getSeconds()))
                .build());
    }

    @GetMapping("/status")
    @Operation(summary = "Current status", description = "Most restrictive limit, remaining quota and reset for a descriptor; does not consume quota")
    public ResponseEntity<RateLimitStatus> status(@RequestParam(required = false) String ip,
                                                  @RequestParam(required = false) String userId,
                                                  @RequestParam(required = false) String tier,
                                                  @RequestParam(defaultValue = "/") String endpoint) {
        AdmissionRequest request = new AdmissionRequest(ip, userId, tier, endpoint);
        Optional<RateLimitStatus> status = rateLimiterService.currentStatus(request.toDescriptor());
        return status.map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private static PolicySummary.EndpointEntry toEntry(EndpointPolicy policy) {
        return PolicySummary.EndpointEntry.builder()
                .pattern(policy.getPattern())
                .rateLimit(policy.getRateLimit())
                .algorithm(policy.getAlgorithm().name().toLowerCase())
                .burstCapacity(policy.getBurstCapacity())
                .description(policy.getDescription())
                .build();
    }
}
