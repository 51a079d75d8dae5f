package com.poolradar.batch;

import com.poolradar.client.CacheMode;
import com.poolradar.client.CancellationToken;
import com.poolradar.client.DexPaprikaClient;
import com.poolradar.domain.Pool;
import com.poolradar.domain.TimeInterval;
import com.poolradar.domain.TimeIntervalMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Polls pool details at a fixed rate and reports each fresh price to a listener. Polls bypass the
 * response cache so a cached entry cannot hide a price move.
 */
@Component
@Slf4j
public class PoolPriceMonitor {

    /**
     * Handle on a running monitor.
     */
    public interface MonitorHandle {

        void stop();

        boolean isStopped();
    }

    private final DexPaprikaClient client;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public PoolPriceMonitor(DexPaprikaClient client,
                            @Qualifier("monitor-scheduler") TaskScheduler scheduler,
                            Clock clock) {
        this.client = client;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Start polling {@code poolAddresses} on {@code network} every {@code interval}. A pool that fails
     * to load, or reports no USD price, is skipped for that round only.
     */
    public MonitorHandle monitor(String network, List<String> poolAddresses, Duration interval,
                                 PriceUpdateListener listener) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        List<String> pools = List.copyOf(poolAddresses);
        CancellationToken token = CancellationToken.create();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> pollOnce(network, pools, listener, token), interval);
        log.info("Monitoring {} pool(s) on {} every {}", pools.size(), network, interval);
        return new MonitorHandle() {
            @Override
            public void stop() {
                token.cancel();
                future.cancel(false);
                log.info("Stopped monitoring {} pool(s) on {}", pools.size(), network);
            }

            @Override
            public boolean isStopped() {
                return future.isCancelled();
            }
        };
    }

    void pollOnce(String network, List<String> pools, PriceUpdateListener listener, CancellationToken token) {
        for (String poolAddress : pools) {
            if (token.isCancelled()) {
                return;
            }
            try {
                Pool pool = client.getPoolDetails(network, poolAddress, false, token, CacheMode.REFRESH);
                if (pool.priceUsd() <= 0) {
                    log.debug("Pool {} on {} reported no USD price", poolAddress, network);
                    continue;
                }
                double volume24h = pool.metrics(TimeInterval.H24).map(TimeIntervalMetrics::volumeUsd).orElse(0.0);
                listener.onUpdate(new PriceUpdate(network, poolAddress, pool.priceUsd(),
                        pool.lastPriceChangeUsd24h(), volume24h, clock.instant()));
            } catch (RuntimeException e) {
                log.warn("Price poll failed for pool {} on {}: {}", poolAddress, network, e.getMessage());
            }
        }
    }
}
