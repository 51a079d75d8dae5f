package com.poolradar.analytics;

import com.poolradar.MutableClock;
import com.poolradar.domain.OhlcvBar;
import com.poolradar.domain.OhlcvSummary;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.poolradar.analytics.AnalyticsFixtures.bar;
import static com.poolradar.analytics.AnalyticsFixtures.close;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OhlcvAnalyticsTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-02T00:00:00Z"));

    @Test
    void volatilityOfFlatSeriesIsZero() {
        assertThat(OhlcvAnalytics.volatility(List.of(close(100), close(100), close(100)))).isZero();
    }

    @Test
    void volatilityOfAlternatingReturns() {
        // returns +10%, -10%, +10%: mean 0.0333, population sd 0.0943
        List<OhlcvBar> bars = List.of(close(100), close(110), close(99), close(108.9));

        assertThat(OhlcvAnalytics.volatility(bars)).isCloseTo(0.0942809, within(1e-6));
    }

    @Test
    void volatilityNeedsTwoReturns() {
        assertThat(OhlcvAnalytics.volatility(List.of(close(100), close(150)))).isZero();
        assertThat(OhlcvAnalytics.volatility(List.of())).isZero();
    }

    @Test
    void volumeWeightedPriceUsesTypicalPrice() {
        List<OhlcvBar> bars = List.of(
                bar("2024-05-01T00:00:00Z", 10, 12, 9, 12, 100),
                bar("2024-05-01T01:00:00Z", 12, 24, 18, 21, 300));

        // typical prices 11 and 21
        assertThat(OhlcvAnalytics.volumeWeightedPrice(bars)).isCloseTo(18.5, within(1e-12));
        assertThat(OhlcvAnalytics.volumeWeightedPrice(List.of(bar("2024-05-01T00:00:00Z", 1, 1, 1, 1, 0)))).isZero();
    }

    @Test
    void priceChange() {
        assertThat(OhlcvAnalytics.priceChange(110, 100)).isCloseTo(10.0, within(1e-12));
        assertThat(OhlcvAnalytics.priceChange(50, 0)).isZero();
    }

    @Test
    void timeframeFilterExcludesBothEnds() {
        List<OhlcvBar> bars = List.of(
                bar("2024-05-01T00:00:00Z", 1, 1, 1, 1, 1),
                bar("2024-05-01T01:00:00Z", 2, 2, 2, 2, 1),
                bar("2024-05-01T02:00:00Z", 3, 3, 3, 3, 1),
                bar("not a time", 4, 4, 4, 4, 1));

        List<OhlcvBar> inside = OhlcvAnalytics.filterByTimeframe(bars, "2024-05-01T00:00:00Z",
                "2024-05-01T02:00:00Z", clock);

        assertThat(inside).extracting(OhlcvBar::open).containsExactly(2.0);
    }

    @Test
    void timeframeFilterDefaultsEndToNow() {
        List<OhlcvBar> bars = List.of(
                bar("2024-05-01T12:00:00Z", 1, 1, 1, 1, 1),
                bar("2024-05-03T00:00:00Z", 2, 2, 2, 2, 1));

        assertThat(OhlcvAnalytics.filterByTimeframe(bars, "2024-05-01T06:00:00Z", null, clock))
                .extracting(OhlcvBar::open).containsExactly(1.0);
        assertThat(OhlcvAnalytics.filterByTimeframe(bars, "garbage", null, clock)).isEqualTo(bars);
    }

    @Test
    void summarize() {
        List<OhlcvBar> bars = List.of(
                bar("2024-05-01T00:00:00Z", 100, 105, 95, 102, 10),
                bar("2024-05-01T01:00:00Z", 102, 120, 101, 110, 20));

        OhlcvSummary summary = OhlcvAnalytics.summarize(bars);

        assertThat(summary.bars()).isEqualTo(2);
        assertThat(summary.open()).isEqualTo(100);
        assertThat(summary.close()).isEqualTo(110);
        assertThat(summary.high()).isEqualTo(120);
        assertThat(summary.low()).isEqualTo(95);
        assertThat(summary.totalVolume()).isEqualTo(30);
        assertThat(summary.priceChangePct()).isCloseTo(10.0, within(1e-12));
        assertThat(OhlcvAnalytics.summarize(List.of())).isEqualTo(OhlcvSummary.EMPTY);
    }
}
