package com.traderank.analytics;

import com.traderank.domain.model.DailySummary;
import com.traderank.domain.model.WeeklySummary;
import com.traderank.domain.vo.DayPnL;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

/**
 * Rolls daily summaries up into ISO weeks. No fills are re-matched: every weekly figure
 * is arithmetic over the contained days.
 *
 * <p>Average win and average loss are weighted by trade counts:
 * {@code sum(day.avgWin * day.winningTrades) / sum(day.winningTrades)}, never the plain
 * mean of daily averages.
 */
@Service
public class WeeklySummaryAggregator {

    /**
     * Groups the given days by ISO week and folds each group.
     *
     * @return one summary per week present, ascending by week start
     */
    public List<WeeklySummary> aggregate(List<DailySummary> dailySummaries) {
        // Monday of the ISO week identifies the week and sorts it
        Map<LocalDate, List<DailySummary>> byWeekStart = new TreeMap<>();
        for (DailySummary daily : dailySummaries) {
            byWeekStart
                    .computeIfAbsent(daily.getDate().with(DayOfWeek.MONDAY), k -> new ArrayList<>())
                    .add(daily);
        }

        List<WeeklySummary> weeks = new ArrayList<>();
        for (Map.Entry<LocalDate, List<DailySummary>> entry : byWeekStart.entrySet()) {
            LocalDate monday = entry.getKey();
            weeks.add(fold(
                    monday.get(IsoFields.WEEK_BASED_YEAR),
                    monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                    entry.getValue()));
        }
        return weeks;
    }

    /**
     * Folds the days of one ISO week into a weekly summary.
     *
     * @param isoYear    ISO week-based year
     * @param weekNumber ISO week number (1-53)
     * @param days       the week's daily summaries, any order
     */
    public WeeklySummary fold(int isoYear, int weekNumber, List<DailySummary> days) {
        LocalDate monday = LocalDate.of(isoYear, 1, 4)
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, weekNumber)
                .with(DayOfWeek.MONDAY);
        Instant weekStart = monday.atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant weekEnd = monday.plusDays(6).atTime(LocalTime.of(23, 59, 59)).toInstant(ZoneOffset.UTC);

        List<DailySummary> ordered = days.stream()
                .sorted(Comparator.comparing(DailySummary::getDate))
                .toList();

        int totalTrades = 0;
        int winningTrades = 0;
        int losingTrades = 0;
        BigDecimal realizedPnl = BigDecimal.ZERO;
        BigDecimal grossPnl = BigDecimal.ZERO;
        BigDecimal totalCommission = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        BigDecimal totalWinAmount = BigDecimal.ZERO;
        BigDecimal totalLossAmount = BigDecimal.ZERO;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;
        TreeSet<String> symbols = new TreeSet<>();
        int profitableDays = 0;

        for (DailySummary daily : ordered) {
            totalTrades += daily.getTotalTrades();
            winningTrades += daily.getWinningTrades();
            losingTrades += daily.getLosingTrades();
            realizedPnl = realizedPnl.add(daily.getRealizedPnl());
            grossPnl = grossPnl.add(daily.getGrossPnl());
            totalCommission = totalCommission.add(daily.getTotalCommission());
            totalVolume = totalVolume.add(daily.getTotalVolume());

            totalWinAmount = totalWinAmount.add(
                    daily.getAvgWin().multiply(BigDecimal.valueOf(daily.getWinningTrades())));
            totalLossAmount = totalLossAmount.add(
                    daily.getAvgLoss().multiply(BigDecimal.valueOf(daily.getLosingTrades())));

            largestWin = largestWin.max(daily.getLargestWin());
            largestLoss = largestLoss.min(daily.getLargestLoss());
            symbols.addAll(daily.getSymbolsTraded());

            if (daily.getRealizedPnl().signum() > 0) {
                profitableDays++;
            }
        }

        int tradingDays = ordered.size();

        return WeeklySummary.builder()
                .weekNumber(weekNumber)
                .isoYear(isoYear)
                .startDate(weekStart)
                .endDate(weekEnd)
                .totalTrades(totalTrades)
                .winningTrades(winningTrades)
                .losingTrades(losingTrades)
                .realizedPnl(realizedPnl)
                .grossPnl(grossPnl)
                .totalCommission(totalCommission)
                .totalVolume(totalVolume)
                .winRate(PerformanceMetrics.winRate(winningTrades, totalTrades))
                .avgWin(PerformanceMetrics.average(totalWinAmount, winningTrades))
                .avgLoss(PerformanceMetrics.average(totalLossAmount, losingTrades))
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .bestDay(PerformanceMetrics.firstMax(ordered, DailySummary::getRealizedPnl)
                        .map(d -> new DayPnL(d.getDate(), d.getRealizedPnl()))
                        .orElse(null))
                .worstDay(PerformanceMetrics.firstMin(ordered, DailySummary::getRealizedPnl)
                        .map(d -> new DayPnL(d.getDate(), d.getRealizedPnl()))
                        .orElse(null))
                .tradingDays(tradingDays)
                .profitableDays(profitableDays)
                .avgDailyPnl(PerformanceMetrics.average(realizedPnl, tradingDays))
                .symbolsTraded(new ArrayList<>(symbols))
                .dailySummaries(new ArrayList<>(ordered))
                .build();
    }
}
