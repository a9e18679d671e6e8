package com.traderank.analytics;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shared arithmetic for the aggregators: win rates, averages and extremum selection.
 */
public final class PerformanceMetrics {

    private PerformanceMetrics() {}

    /** {@code wins / total * 100}, or 0 when {@code total} is 0. */
    public static double winRate(int wins, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return (double) wins / total * 100.0;
    }

    /** {@code sum / count} at DECIMAL128 precision, or 0 when {@code count} is 0. */
    public static BigDecimal average(BigDecimal sum, int count) {
        if (count <= 0) {
            return BigDecimal.ZERO;
        }
        return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
    }

    /**
     * First element holding the maximum key. Earlier elements win ties, so callers
     * pass lists already sorted by date / week / hour for a deterministic result.
     */
    public static <T> Optional<T> firstMax(List<T> items, Function<T, BigDecimal> key) {
        T best = null;
        for (T item : items) {
            if (best == null || key.apply(item).compareTo(key.apply(best)) > 0) {
                best = item;
            }
        }
        return Optional.ofNullable(best);
    }

    /** First element holding the minimum key. See {@link #firstMax}. */
    public static <T> Optional<T> firstMin(List<T> items, Function<T, BigDecimal> key) {
        T worst = null;
        for (T item : items) {
            if (worst == null || key.apply(item).compareTo(key.apply(worst)) < 0) {
                worst = item;
            }
        }
        return Optional.ofNullable(worst);
    }
}
