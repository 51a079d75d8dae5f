package com.poolradar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.batch.BatchDispatcher;
import com.poolradar.cache.CacheMirror;
import com.poolradar.cache.FileCacheMirror;
import com.poolradar.cache.ResponseCache;
import com.poolradar.client.ApiJson;
import com.poolradar.client.ApiTransport;
import com.poolradar.client.RequestGateway;
import com.poolradar.client.RetryingCall;
import com.poolradar.client.WebClientApiTransport;
import com.poolradar.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the cache, gateway and dispatcher from {@link PoolRadarProperties}. Services in the client, batch
 * and insight packages are picked up by component scan.
 */
@AutoConfiguration
@EnableConfigurationProperties(PoolRadarProperties.class)
@Import({AsyncConfig.class, SchedulerConfig.class})
@ComponentScan(basePackages = {"com.poolradar.client", "com.poolradar.batch", "com.poolradar.insight"})
@Slf4j
public class PoolRadarAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseCache responseCache(PoolRadarProperties properties, Clock clock) {
        PoolRadarProperties.CacheProperties cache = properties.getCache();
        return new ResponseCache(cache.getTtl(), cache.getMaximumSize(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheMirror cacheMirror(PoolRadarProperties properties, Clock clock) {
        PoolRadarProperties.CacheProperties cache = properties.getCache();
        if (cache.getDirectory() == null || cache.getDirectory().isBlank()) {
            return CacheMirror.NONE;
        }
        log.info("Mirroring response cache to {}", cache.getDirectory());
        return new FileCacheMirror(Path.of(cache.getDirectory()), ApiJson.objectMapper(), cache.getTtl(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApiTransport apiTransport(ObjectProvider<WebClient.Builder> webClientBuilder, PoolRadarProperties properties) {
        return new WebClientApiTransport(webClientBuilder.getIfAvailable(WebClient::builder),
                properties.getApi().getBaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestGateway requestGateway(ApiTransport transport, ResponseCache cache, CacheMirror mirror,
                                         PoolRadarProperties properties) {
        PoolRadarProperties.ApiProperties api = properties.getApi();
        ObjectMapper objectMapper = ApiJson.objectMapper();
        return new RequestGateway(transport, cache, mirror, objectMapper, api.getRequestTimeout(),
                rateLimiter(api.getRequestsPerSecond()));
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchDispatcher batchDispatcher(@Qualifier(AsyncConfig.BATCH_EXECUTOR) Executor executor,
                                           PoolRadarProperties properties) {
        return new BatchDispatcher(executor, properties.getBatch().getMaxConcurrency());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(PoolRadarProperties properties) {
        PoolRadarProperties.RetryProperties retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryingCall retryingCall(RetryPolicy retryPolicy) {
        return new RetryingCall(retryPolicy);
    }

    /**
     * Null when {@code requestsPerSecond} is not positive. Callers wait up to one refresh period for a permit.
     */
    static RateLimiter rateLimiter(int requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            return null;
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(requestsPerSecond)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofSeconds(1))
                .build();
        return RateLimiter.of("dexpaprika", config);
    }
}
