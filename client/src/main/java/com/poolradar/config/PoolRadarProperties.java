package com.poolradar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Client configuration under {@code poolradar.*}. The defaults below apply when the host application
 * sets nothing; IDE metadata is generated from the field comments.
 */
@ConfigurationProperties(prefix = "poolradar")
@Getter
@Setter
public class PoolRadarProperties {

    private ApiProperties api = new ApiProperties();

    private CacheProperties cache = new CacheProperties();

    private BatchProperties batch = new BatchProperties();

    private RetryProperties retry = new RetryProperties();

    @Getter
    @Setter
    public static class ApiProperties {
        /** DexPaprika REST base URL. */
        private String baseUrl = "https://api.dexpaprika.com";
        /** Upper bound for one HTTP call, including reading the body. */
        private Duration requestTimeout = Duration.ofSeconds(10);
        /** Client-side request rate limit; 0 disables limiting. */
        private int requestsPerSecond = 0;
    }

    @Getter
    @Setter
    public static class CacheProperties {
        /** Freshness window of cached responses. */
        private Duration ttl = Duration.ofMinutes(5);
        /** Entry cap for the in-memory cache. */
        private long maximumSize = 10_000;
        /**
         * Directory for the on-disk mirror of cached responses, so entries survive restarts.
         * Unset disables the mirror.
         */
        private String directory;
    }

    @Getter
    @Setter
    public static class BatchProperties {
        /** Maximum concurrently running batch targets; 0 means unbounded. */
        private int maxConcurrency = 0;
    }

    @Getter
    @Setter
    public static class RetryProperties {
        /** Delay before the first retry; doubles with every further attempt. */
        private long baseDelayMs = 1000;
        /** Random spread applied to each delay, as a fraction of it. */
        private double jitterFactor = 0.2;
        /** Total attempts including the first one. */
        private int maxAttempts = 3;
    }
}
