package com.poolradar.config;

import com.poolradar.batch.BatchDispatcher;
import com.poolradar.batch.MarketDataBatchService;
import com.poolradar.batch.PoolPriceMonitor;
import com.poolradar.cache.CacheMirror;
import com.poolradar.cache.FileCacheMirror;
import com.poolradar.cache.ResponseCache;
import com.poolradar.client.ApiTransport;
import com.poolradar.client.DexPaprikaClient;
import com.poolradar.client.RequestGateway;
import com.poolradar.client.RetryingCall;
import com.poolradar.client.TransportResponse;
import com.poolradar.client.WebClientApiTransport;
import com.poolradar.insight.MarketInsightsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PoolRadarAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PoolRadarAutoConfiguration.class));

    @Test
    @DisplayName("default context wires the client, batch and insight services")
    void defaultContext() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(RequestGateway.class);
            assertThat(context).hasSingleBean(DexPaprikaClient.class);
            assertThat(context).hasSingleBean(MarketDataBatchService.class);
            assertThat(context).hasSingleBean(PoolPriceMonitor.class);
            assertThat(context).hasSingleBean(MarketInsightsService.class);
            assertThat(context).hasSingleBean(RetryingCall.class);
            assertThat(context.getBean(ApiTransport.class)).isInstanceOf(WebClientApiTransport.class);
            assertThat(context.getBean(CacheMirror.class)).isSameAs(CacheMirror.NONE);
            assertThat(context.getBean(BatchDispatcher.class).getMaxConcurrency()).isZero();
        });
    }

    @Test
    @DisplayName("defaults come from the properties class when the host sets nothing")
    void propertyDefaults() {
        runner.run(context -> {
            PoolRadarProperties properties = context.getBean(PoolRadarProperties.class);
            assertThat(properties.getApi().getBaseUrl()).isEqualTo("https://api.dexpaprika.com");
            assertThat(properties.getApi().getRequestTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(properties.getApi().getRequestsPerSecond()).isZero();
            assertThat(properties.getCache().getTtl()).isEqualTo(Duration.ofMinutes(5));
            assertThat(properties.getCache().getMaximumSize()).isEqualTo(10_000);
            assertThat(properties.getCache().getDirectory()).isNull();
            assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(context.getBean(ResponseCache.class).getTtl()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    @DisplayName("properties drive concurrency and the cache mirror")
    void propertiesApplied(@TempDir Path dir) {
        runner.withPropertyValues(
                        "poolradar.batch.max-concurrency=3",
                        "poolradar.cache.directory=" + dir)
                .run(context -> {
                    assertThat(context.getBean(BatchDispatcher.class).getMaxConcurrency()).isEqualTo(3);
                    assertThat(context.getBean(CacheMirror.class)).isInstanceOf(FileCacheMirror.class);
                    assertThat(((FileCacheMirror) context.getBean(CacheMirror.class)).getDirectory()).isEqualTo(dir);
                });
    }

    @Test
    @DisplayName("user-supplied transport replaces the WebClient one")
    void customTransport() {
        ApiTransport stub = (endpoint, params) -> Mono.just(new TransportResponse(200, "[]"));
        runner.withBean(ApiTransport.class, () -> stub)
                .run(context -> assertThat(context.getBean(ApiTransport.class)).isSameAs(stub));
    }

    @Test
    @DisplayName("batch executor and monitor scheduler are configured")
    void executors() {
        runner.run(context -> {
            ThreadPoolTaskExecutor batch = context.getBean(AsyncConfig.BATCH_EXECUTOR, ThreadPoolTaskExecutor.class);
            assertThat(batch.getCorePoolSize()).isEqualTo(4);
            assertThat(batch.getMaxPoolSize()).isEqualTo(256);
            assertThat(batch.getThreadNamePrefix()).isEqualTo("batch-");

            ThreadPoolTaskScheduler scheduler =
                    context.getBean(SchedulerConfig.MONITOR_SCHEDULER, ThreadPoolTaskScheduler.class);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("monitor-");
            assertThat(scheduler.getPoolSize()).isLessThanOrEqualTo(2);
        });
    }

    @Test
    void rateLimiterOnlyWhenPositive() {
        assertThat(PoolRadarAutoConfiguration.rateLimiter(0)).isNull();
        RateLimiter limiter = PoolRadarAutoConfiguration.rateLimiter(5);
        assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(5);
    }
}
