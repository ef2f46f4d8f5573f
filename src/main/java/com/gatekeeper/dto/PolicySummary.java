package com.gatekeeper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicySummary {
    private String defaultTier;
    private Map<String, String> tiers;
    private List<EndpointEntry> endpoints;
    private IpEntry ip;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EndpointEntry {
        private String pattern;
        private String rateLimit;
        private String algorithm;
        private Integer burstCapacity;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IpEntry {
        private int maxRequests;
        private long windowSeconds;
    }
}
