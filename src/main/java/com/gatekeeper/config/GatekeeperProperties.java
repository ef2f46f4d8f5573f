package com.gatekeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code gatekeeper.*}. Bound once at startup; the policy tables are
 * not reloaded while the service runs.
 */
@Data
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    private boolean failOpen = true;
    private String defaultTier = "free";

    // tier name -> requests per minute, or "unlimited"
    private Map<String, String> tiers = new LinkedHashMap<>();
    private List<Endpoint> endpoints = new ArrayList<>();

    private Ip ip = new Ip();
    private Dos dos = new Dos();
    private Storage storage = new Storage();
    private Filter filter = new Filter();

    @Data
    public static class Endpoint {
        private String pattern;
        private String rateLimit;
        private String algorithm;
        private Integer burstCapacity;
    }

    @Data
    public static class Ip {
        private int maxRequests = 100;
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Dos {
        private boolean enabled = true;
        private int maxRequests = 300;
        private Duration window = Duration.ofSeconds(60);
        private Duration banDuration = Duration.ofMinutes(5);
        private long maxTrackedIps = 100_000;
    }

    @Data
    public static class Storage {
        private StorageType type = StorageType.MEMORY;
        private Memory memory = new Memory();
        private Redis redis = new Redis();
    }

    public enum StorageType {
        MEMORY,
        JDBC,
        REDIS
    }

    @Data
    public static class Memory {
        private long maxKeys = 100_000;
        private Duration idleEviction = Duration.ofDays(1);
    }

    @Data
    public static class Redis {
        private String keyPrefix = "gatekeeper:";
        private int maxRetries = 32;
        // must outlive the longest configured window
        private Duration keyTtl = Duration.ofDays(2);
    }

    @Data
    public static class Filter {
        private boolean enabled = true;
        private boolean trustForwardedFor = false;
        private List<String> excludedPaths = new ArrayList<>(List.of("/actuator", "/api/ratelimit", "/api/admin"));
    }
}
