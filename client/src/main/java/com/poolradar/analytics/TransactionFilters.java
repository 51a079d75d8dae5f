package com.poolradar.analytics;

import com.poolradar.domain.Timestamps;
import com.poolradar.domain.Transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

public final class TransactionFilters {

    private TransactionFilters() {
    }

    /**
     * Transactions created within the last {@code hours}. Transactions with an unparseable timestamp are dropped.
     */
    public static List<Transaction> recent(Collection<Transaction> transactions, int hours, Clock clock) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        return transactions.stream()
                .filter(tx -> Timestamps.parse(tx.createdAt()).map(t -> t.isAfter(cutoff)).orElse(false))
                .toList();
    }

    /** Transactions whose combined USD value is at least {@code minUsd}. */
    public static List<Transaction> large(Collection<Transaction> transactions, double minUsd) {
        return transactions.stream()
                .filter(tx -> tx.totalUsd() >= minUsd)
                .toList();
    }

    public static double totalUsd(Collection<Transaction> transactions) {
        return transactions.stream().mapToDouble(Transaction::totalUsd).sum();
    }
}
