package com.poolradar.analytics;

import com.poolradar.domain.Pool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.poolradar.analytics.AnalyticsFixtures.pool;
import static com.poolradar.analytics.AnalyticsFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;

class PoolFiltersTest {

    private final Pool weth = pool("weth-usdc", "Uniswap V3", "ethereum", 5_000_000, 1200, 3100, -4.5,
            token("0xC02A", "WETH"), token("0xa0b8", "USDC"));
    private final Pool pepe = pool("pepe-weth", "Uniswap V2", "ethereum", 800_000, 900, 0.00001, 35.0,
            token("0x6982", "PEPE"), token("0xc02a", "WETH"));
    private final Pool bonk = pool("bonk-sol", "Raydium", "Solana", 2_000_000, 3000, 0.00002, -12.0,
            token("DezX", "BONK"), token("So11", "SOL"));
    private final Pool quiet = pool("quiet", "Raydium", "solana", 1_000, 2, 1.0, 80.0);
    private final List<Pool> pools = List.of(weth, pepe, bonk, quiet);

    @Test
    void byPriceChangeUsesMagnitude() {
        assertThat(PoolFilters.byPriceChange(pools, 10)).containsExactly(pepe, bonk, quiet);
    }

    @Test
    void byVolumeIsInclusive() {
        assertThat(PoolFilters.byVolume(pools, 2_000_000)).containsExactly(weth, bonk);
    }

    @Test
    void byNetworkIgnoresCase() {
        assertThat(PoolFilters.byNetwork(pools, "SOLANA")).containsExactly(bonk, quiet);
    }

    @Test
    void byDexMatchesSubstring() {
        assertThat(PoolFilters.byDex(pools, "uniswap")).containsExactly(weth, pepe);
    }

    @Test
    void byTokenSymbolAndAddress() {
        assertThat(PoolFilters.byTokenSymbol(pools, "weth")).containsExactly(weth, pepe);
        assertThat(PoolFilters.byTokenAddress(pools, "0xc02a")).containsExactly(weth, pepe);
        assertThat(PoolFilters.byTokenSymbol(pools, "DOGE")).isEmpty();
    }

    @Test
    void sortIsStableForTies() {
        Pool a = pool("a", "X", "ethereum", 100, 0, 1, 0);
        Pool b = pool("b", "X", "ethereum", 100, 0, 1, 0);
        Pool c = pool("c", "X", "ethereum", 300, 0, 1, 0);

        assertThat(PoolFilters.sortByField(List.of(a, b, c), PoolField.VOLUME_USD, true)).containsExactly(c, a, b);
        assertThat(PoolFilters.sortByField(List.of(a, b, c), PoolField.VOLUME_USD, false)).containsExactly(a, b, c);
    }

    @Test
    void topAndBottomN() {
        assertThat(PoolFilters.topN(pools, PoolField.TRANSACTIONS, 2)).containsExactly(bonk, weth);
        assertThat(PoolFilters.bottomN(pools, PoolField.VOLUME_USD, 1)).containsExactly(quiet);
        assertThat(PoolFilters.topN(pools, PoolField.VOLUME_USD, 10)).hasSize(4);
        assertThat(PoolFilters.topN(pools, PoolField.VOLUME_USD, 0)).isEmpty();
    }

    @Test
    void topMoversSkipsThinPools() {
        assertThat(PoolFilters.topMovers(pools, 10_000, 2)).containsExactly(pepe, bonk);
    }

    @Test
    void fieldLookupByApiName() {
        assertThat(PoolField.from("Volume_USD")).contains(PoolField.VOLUME_USD);
        assertThat(PoolField.from("reserve_usd")).isEmpty();
        assertThat(PoolField.extract(weth, "price_usd")).isEqualTo(3100.0);
        assertThat(PoolField.extract(weth, "reserve_usd")).isZero();
    }
}
