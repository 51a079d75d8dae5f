package com.poolradar.analytics;

import com.poolradar.domain.Pool;
import com.poolradar.domain.Token;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Filtering and ordering over pool lists. All results are new lists; sorts are stable so pools with
 * equal keys keep their input order.
 */
public final class PoolFilters {

    private PoolFilters() {
    }

    /** Pools whose 24h USD price change is at least {@code minChange} in either direction. */
    public static List<Pool> byPriceChange(Collection<Pool> pools, double minChange) {
        return filter(pools, p -> Math.abs(PoolField.LAST_PRICE_CHANGE_USD_24H.extract(p)) >= minChange);
    }

    public static List<Pool> byVolume(Collection<Pool> pools, double minVolume) {
        return filter(pools, p -> PoolField.VOLUME_USD.extract(p) >= minVolume);
    }

    public static List<Pool> byNetwork(Collection<Pool> pools, String network) {
        String wanted = lower(network);
        return filter(pools, p -> lower(p.chain()).equals(wanted));
    }

    /** Pools whose DEX name contains {@code dexName}, ignoring case. */
    public static List<Pool> byDex(Collection<Pool> pools, String dexName) {
        String wanted = lower(dexName);
        return filter(pools, p -> lower(p.dexName()).contains(wanted));
    }

    public static List<Pool> byTokenSymbol(Collection<Pool> pools, String symbol) {
        String wanted = lower(symbol);
        return filter(pools, p -> p.tokens().stream().map(Token::symbol).anyMatch(s -> lower(s).equals(wanted)));
    }

    public static List<Pool> byTokenAddress(Collection<Pool> pools, String address) {
        String wanted = lower(address);
        return filter(pools, p -> p.tokens().stream().map(Token::id).anyMatch(id -> lower(id).equals(wanted)));
    }

    public static List<Pool> sortByField(Collection<Pool> pools, PoolField field, boolean descending) {
        Comparator<Pool> comparator = Comparator.comparingDouble(field::extract);
        return pools.stream()
                .sorted(descending ? comparator.reversed() : comparator)
                .toList();
    }

    /** The {@code n} largest pools by {@code field}; all of them if there are fewer. */
    public static List<Pool> topN(Collection<Pool> pools, PoolField field, int n) {
        return sortByField(pools, field, true).stream().limit(Math.max(0, n)).toList();
    }

    public static List<Pool> bottomN(Collection<Pool> pools, PoolField field, int n) {
        return sortByField(pools, field, false).stream().limit(Math.max(0, n)).toList();
    }

    /**
     * Pools with at least {@code minVolume} USD volume, ordered by absolute 24h price change, largest first.
     */
    public static List<Pool> topMovers(Collection<Pool> pools, double minVolume, int limit) {
        Comparator<Pool> byAbsChange = Comparator.comparingDouble(
                p -> Math.abs(PoolField.LAST_PRICE_CHANGE_USD_24H.extract(p)));
        return byVolume(pools, minVolume).stream()
                .sorted(byAbsChange.reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    private static List<Pool> filter(Collection<Pool> pools, Predicate<Pool> predicate) {
        return pools.stream().filter(predicate).toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
