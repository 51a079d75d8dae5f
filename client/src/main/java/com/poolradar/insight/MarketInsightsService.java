package com.poolradar.insight;

import com.poolradar.analytics.LiquidityAnalyzer;
import com.poolradar.analytics.PoolField;
import com.poolradar.analytics.PoolFilters;
import com.poolradar.client.ApiQuery;
import com.poolradar.client.DexPaprikaClient;
import com.poolradar.client.PaprikaApiException;
import com.poolradar.client.RequestCancelledException;
import com.poolradar.domain.MarketOverview;
import com.poolradar.domain.Network;
import com.poolradar.domain.NetworkSnapshot;
import com.poolradar.domain.Pool;
import com.poolradar.domain.SystemStats;
import com.poolradar.domain.Token;
import com.poolradar.domain.TokenLiquidityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composite market views built from several API calls plus the analytics functions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketInsightsService {

    static final int OVERVIEW_NETWORKS = 5;
    static final int OVERVIEW_POOLS_PER_NETWORK = 10;
    static final int TOKEN_REPORT_POOLS = 50;

    private final DexPaprikaClient client;
    private final Clock clock;

    /**
     * Biggest absolute 24h price movers among pools with at least {@code minVolume} USD volume. Fetches
     * three times {@code limit} pools so the volume filter leaves enough candidates.
     */
    public List<Pool> topMovers(String network, int limit, double minVolume) {
        List<Pool> pools = client.getNetworkPools(network, ApiQuery.ofLimit(limit * 3)).pools();
        return PoolFilters.topMovers(pools, minVolume, limit);
    }

    public List<Pool> highVolumePools(String network, int limit) {
        ApiQuery query = ApiQuery.builder()
                .limit(limit)
                .orderBy(PoolField.VOLUME_USD.apiName())
                .sort("desc")
                .build();
        return client.getNetworkPools(network, query).pools();
    }

    public TokenLiquidityReport tokenLiquidityReport(String network, String tokenAddress) {
        Token token = client.getTokenDetails(network, tokenAddress);
        List<Pool> pools = client.getTokenPools(network, tokenAddress, ApiQuery.ofLimit(TOKEN_REPORT_POOLS)).pools();
        if (pools.isEmpty()) {
            return new TokenLiquidityReport(token, 0, null, null, null);
        }
        Pool largest = pools.stream()
                .max(Comparator.comparingDouble(PoolField.VOLUME_USD::extract))
                .orElseThrow();
        return new TokenLiquidityReport(token, pools.size(),
                LiquidityAnalyzer.analyzeLiquidity(pools), largest, LiquidityAnalyzer.analyzeDexDistribution(pools));
    }

    /**
     * System stats plus total volume of the top pools for the first networks the API lists. A network
     * whose pools cannot be loaded, or that has no id, is left out of the overview.
     */
    public MarketOverview marketOverview() {
        SystemStats stats = client.getStats();
        List<Network> networks = client.getNetworks();
        Map<String, NetworkSnapshot> overview = new LinkedHashMap<>();
        List<Network> usable = new ArrayList<>();
        for (Network network : networks) {
            if (usable.size() == OVERVIEW_NETWORKS) {
                break;
            }
            if (hasId(network)) {
                usable.add(network);
            } else {
                log.debug("Skipping network without id in market overview: {}", network);
            }
        }
        for (Network network : usable) {
            try {
                List<Pool> pools = client.getNetworkPools(network.id(), ApiQuery.ofLimit(OVERVIEW_POOLS_PER_NETWORK)).pools();
                double volume = pools.stream().mapToDouble(PoolField.VOLUME_USD::extract).sum();
                overview.put(network.id(), new NetworkSnapshot(network.displayName(), volume, pools.size()));
            } catch (RequestCancelledException e) {
                throw e;
            } catch (PaprikaApiException e) {
                log.warn("Skipping network {} in market overview: {}", network.id(), e.getMessage());
            }
        }
        return new MarketOverview(stats, overview, clock.instant());
    }

    private static boolean hasId(Network network) {
        return network.id() != null && !network.id().isBlank();
    }
}
