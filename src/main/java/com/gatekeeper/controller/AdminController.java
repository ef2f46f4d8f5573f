package com.gatekeeper.controller;

import com.gatekeeper.dto.LimiterStats;
import com.gatekeeper.model.LimitDimension;
import com.gatekeeper.service.RateLimiterService;
import com.gatekeeper.storage.RateLimitStorageException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Administrative operations")
public class AdminController {

    private final RateLimiterService rateLimiterService;

    @DeleteMapping("/keys")
    @Operation(summary = "Reset a limit",
            description = "Forget the stored quota of one IP, user or endpoint policy (dimension = ip, user or endpoint)")
    public ResponseEntity<Void> resetKey(@RequestParam String dimension, @RequestParam String value) {
        Optional<String> reset;
        try {
            reset = rateLimiterService.reset(LimitDimension.fromSelector(dimension), value);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected reset request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (RateLimitStorageException e) {
            log.error("Could not reset {} limit for: {}", dimension, value, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }

        if (reset.isEmpty()) {
            log.info("No endpoint policy governs {}, nothing to reset", value);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    @Operation(summary = "Get limiter statistics", description = "Limiter cache usage and loaded policy counts")
    public ResponseEntity<LimiterStats> getStats() {
        return ResponseEntity.ok(rateLimiterService.stats());
    }

    @PostMapping("/cache/clear")
    @Operation(summary = "Clear limiter cache",
            description = "Drop cached limiter instances; stored quotas are kept and limiters are rebuilt on demand")
    public ResponseEntity<Void> clearCache() {
        rateLimiterService.clearLimiterCache();
        return ResponseEntity.ok().build();
    }
}
