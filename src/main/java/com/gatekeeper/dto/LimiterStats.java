package com.gatekeeper.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the limiter cache and the loaded policy tables.
 * {@code cacheHitRate} is a percentage, or -1 when cache statistics are disabled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimiterStats {
    private String backend;
    private long cachedLimiters;
    private long cacheHits;
    private long cacheMisses;
    private long cacheEvictions;
    private double cacheHitRate;
    private int tiers;
    private int endpointPolicies;
    private boolean failOpen;
}
