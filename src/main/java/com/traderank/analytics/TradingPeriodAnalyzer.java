package com.traderank.analytics;

import com.traderank.config.TradingPeriodConfig;
import com.traderank.domain.model.TradeRecord;
import com.traderank.domain.model.TradingPeriod;
import com.traderank.exception.AnalyticsConfigurationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ranks named time-of-day windows by the net P&L of the fills executed inside them.
 *
 * <p>No position matching happens here. Each fill contributes its own recorded net P&L
 * ({@link TradeRecord#netPnl()}), and the date is ignored: a fill at 10:30 on any day
 * lands in "Morning". Fills outside every window are excluded.
 *
 * <p>The window table comes from {@link TradingPeriodConfig} and is checked once at
 * construction: each window must have {@code startHour < endHour} and windows may not
 * overlap.
 */
@Service
public class TradingPeriodAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TradingPeriodAnalyzer.class);

    private final List<TradingPeriodConfig.Window> windows;
    private final int defaultTopCount;

    public TradingPeriodAnalyzer(TradingPeriodConfig tradingPeriodConfig) {
        this.windows = List.copyOf(tradingPeriodConfig.getWindows());
        this.defaultTopCount = tradingPeriodConfig.getTopCount();
        validateWindows(windows);
        log.info("Trading period table loaded with {} windows", windows.size());
    }

    /**
     * Computes every configured window and sorts them by total P&L, best first.
     * Windows with equal P&L keep their table order.
     */
    public List<TradingPeriod> identifyBestTradingPeriods(Collection<TradeRecord> trades) {
        TradePreconditions.checkAll(trades);

        Map<Integer, List<TradeRecord>> byHour = TradeGrouping.byHour(trades);
        List<TradingPeriod> periods = new ArrayList<>();
        for (TradingPeriodConfig.Window window : windows) {
            periods.add(calculatePeriod(window, byHour));
        }

        periods.sort(Comparator.comparing(TradingPeriod::getTotalPnl).reversed());
        return periods;
    }

    /** The first {@code limit} entries of {@link #identifyBestTradingPeriods}. */
    public List<TradingPeriod> topPeriods(Collection<TradeRecord> trades, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<TradingPeriod> ranked = identifyBestTradingPeriods(trades);
        return new ArrayList<>(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    /** Top-N ranking using the configured {@code traderank.periods.top-count}. */
    public List<TradingPeriod> topPeriods(Collection<TradeRecord> trades) {
        return topPeriods(trades, defaultTopCount);
    }

    private TradingPeriod calculatePeriod(TradingPeriodConfig.Window window, Map<Integer, List<TradeRecord>> byHour) {
        int count = 0;
        int wins = 0;
        int losses = 0;
        BigDecimal totalPnl = BigDecimal.ZERO;

        for (int hour = window.getStartHour(); hour < window.getEndHour(); hour++) {
            for (TradeRecord trade : byHour.getOrDefault(hour, List.of())) {
                BigDecimal pnl = trade.netPnl();
                count++;
                totalPnl = totalPnl.add(pnl);
                if (pnl.signum() > 0) {
                    wins++;
                } else if (pnl.signum() < 0) {
                    losses++;
                }
            }
        }

        return TradingPeriod.builder()
                .name(window.getName())
                .startHour(window.getStartHour())
                .endHour(window.getEndHour())
                .totalTrades(count)
                .totalPnl(totalPnl)
                .winRate(PerformanceMetrics.winRate(wins, wins + losses))
                .avgPnlPerTrade(PerformanceMetrics.average(totalPnl, count))
                .build();
    }

    private static void validateWindows(List<TradingPeriodConfig.Window> windows) {
        boolean[] claimed = new boolean[24];
        String[] owner = new String[24];
        for (TradingPeriodConfig.Window window : windows) {
            if (window.getStartHour() < 0 || window.getEndHour() > 24 || window.getStartHour() >= window.getEndHour()) {
                throw new AnalyticsConfigurationException(
                        "Trading period '" + window.getName() + "' must satisfy 0 <= start < end <= 24",
                        Map.of("start", window.getStartHour(), "end", window.getEndHour()));
            }
            for (int hour = window.getStartHour(); hour < window.getEndHour(); hour++) {
                if (claimed[hour]) {
                    throw new AnalyticsConfigurationException(
                            "Trading periods '" + owner[hour] + "' and '" + window.getName() + "' overlap",
                            Map.of("hour", hour));
                }
                claimed[hour] = true;
                owner[hour] = window.getName();
            }
        }
    }
}
