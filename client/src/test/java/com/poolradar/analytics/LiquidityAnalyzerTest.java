package com.poolradar.analytics;

import com.poolradar.domain.DexDistribution;
import com.poolradar.domain.LiquidityAnalysis;
import com.poolradar.domain.Pool;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.poolradar.analytics.AnalyticsFixtures.volumePool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class LiquidityAnalyzerTest {

    private final List<Pool> pools = List.of(
            volumePool("small", "A", 500_000),
            volumePool("mid", "A", 2_000_000),
            volumePool("large", "B", 20_000_000),
            volumePool("huge", null, 200_000_000));

    @Test
    void liquidityBucketsAndConcentration() {
        LiquidityAnalysis analysis = LiquidityAnalyzer.analyzeLiquidity(pools);

        assertThat(analysis.totalLiquidity()).isEqualTo(222_500_000.0);
        assertThat(analysis.poolCount()).isEqualTo(4);
        assertThat(analysis.averageLiquidity()).isEqualTo(55_625_000.0);
        assertThat(analysis.medianLiquidity()).isEqualTo(11_000_000.0);
        assertThat(analysis.topPoolsShare()).isCloseTo(200.0 / 222.5, within(1e-12));
        assertThat(analysis.giniCoefficient()).isBetween(0.0, 1.0);
        assertThat(analysis.distribution()).containsExactly(
                entry("< 1M", 0.25), entry("1M-10M", 0.25), entry("10M-100M", 0.25), entry("> 100M", 0.25));
    }

    @Test
    void topDecileRoundsUp() {
        List<Pool> eleven = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            eleven.add(volumePool("p" + i, "A", 10));
        }
        eleven.add(volumePool("second", "A", 400));
        eleven.add(volumePool("first", "A", 510));

        // ceil(11 / 10) = 2 pools in the top decile
        assertThat(LiquidityAnalyzer.analyzeLiquidity(eleven).topPoolsShare()).isCloseTo(0.91, within(1e-12));
    }

    @Test
    void emptyInput() {
        assertThat(LiquidityAnalyzer.analyzeLiquidity(List.of())).isEqualTo(LiquidityAnalysis.EMPTY);
        assertThat(LiquidityAnalyzer.analyzeDexDistribution(List.of())).isEqualTo(DexDistribution.EMPTY);
    }

    @Test
    void dexDistributionAndHerfindahlIndex() {
        DexDistribution distribution = LiquidityAnalyzer.analyzeDexDistribution(pools);

        double a = 2.5 / 222.5;
        double b = 20 / 222.5;
        double unknown = 200 / 222.5;
        assertThat(distribution.dexCount()).isEqualTo(3);
        assertThat(distribution.totalVolume()).isEqualTo(222_500_000.0);
        assertThat(distribution.topDexes()).containsExactly(LiquidityAnalyzer.UNKNOWN_DEX, "B", "A");
        assertThat(distribution.distribution().get("A")).isCloseTo(a, within(1e-12));
        assertThat(distribution.distribution().get(LiquidityAnalyzer.UNKNOWN_DEX)).isCloseTo(unknown, within(1e-12));
        assertThat(distribution.concentration()).isCloseTo(a * a + b * b + unknown * unknown, within(1e-12));
    }

    @Test
    void zeroVolumeLeavesSharesEmpty() {
        DexDistribution distribution = LiquidityAnalyzer.analyzeDexDistribution(
                List.of(volumePool("x", "A", 0), volumePool("y", "B", 0)));

        assertThat(distribution.dexCount()).isEqualTo(2);
        assertThat(distribution.distribution()).isEmpty();
        assertThat(distribution.concentration()).isZero();
    }
}
