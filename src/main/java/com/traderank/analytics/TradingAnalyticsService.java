package com.traderank.analytics;

import com.traderank.config.AnalyticsProperties;
import com.traderank.diagnostics.MatchDiagnosticSink;
import com.traderank.domain.model.DailySummary;
import com.traderank.domain.model.TimeSlotPerformance;
import com.traderank.domain.model.TradeRecord;
import com.traderank.domain.model.TradingPeriod;
import com.traderank.domain.model.TradingSummary;
import com.traderank.domain.model.WeeklySummary;
import com.traderank.domain.vo.DayPnL;
import com.traderank.domain.vo.HourPnL;
import com.traderank.domain.vo.WeekPnL;
import com.traderank.event.EventPublisherHelper;
import com.traderank.exception.AnalyticsException;
import com.traderank.exception.BaseException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of the analysis engine. Collaborators (ingestion, persistence,
 * presentation) call this service and never the individual aggregators.
 *
 * <p>A run recomputes everything from the supplied fills:
 * <ol>
 *   <li>Validate every fill ({@link TradePreconditions}); a bad record aborts the run.</li>
 *   <li>Group fills by UTC date and build one {@link DailySummary} per date, sequentially
 *       or on {@code analyticsExecutor} when {@code traderank.analytics.parallel} is set.</li>
 *   <li>Roll days up into ISO weeks ({@link WeeklySummaryAggregator}).</li>
 *   <li>Fold totals and pick best/worst day, week and hour.</li>
 *   <li>Publish a {@link com.traderank.event.TradingSummaryEvent}.</li>
 * </ol>
 *
 * <p>Ties for best/worst are broken deterministically: the earliest day, the earliest
 * week and the lowest hour win.
 */
@Service
public class TradingAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(TradingAnalyticsService.class);

    private final DailySummaryCalculator dailySummaryCalculator;
    private final WeeklySummaryAggregator weeklySummaryAggregator;
    private final TradingPeriodAnalyzer tradingPeriodAnalyzer;
    private final MatchDiagnosticSink diagnosticSink;
    private final EventPublisherHelper eventPublisherHelper;
    private final AnalyticsProperties analyticsProperties;
    private final Executor analyticsExecutor;

    public TradingAnalyticsService(
            DailySummaryCalculator dailySummaryCalculator,
            WeeklySummaryAggregator weeklySummaryAggregator,
            TradingPeriodAnalyzer tradingPeriodAnalyzer,
            MatchDiagnosticSink diagnosticSink,
            EventPublisherHelper eventPublisherHelper,
            AnalyticsProperties analyticsProperties,
            @Qualifier("analyticsExecutor") Executor analyticsExecutor) {
        this.dailySummaryCalculator = dailySummaryCalculator;
        this.weeklySummaryAggregator = weeklySummaryAggregator;
        this.tradingPeriodAnalyzer = tradingPeriodAnalyzer;
        this.diagnosticSink = diagnosticSink;
        this.eventPublisherHelper = eventPublisherHelper;
        this.analyticsProperties = analyticsProperties;
        this.analyticsExecutor = analyticsExecutor;
    }

    /**
     * Analyzes the full trade set using the configured diagnostic sink.
     *
     * @param trades deduplicated, validated fills; may be empty
     * @return the trading summary for every date present
     */
    public TradingSummary analyzeTrades(Collection<TradeRecord> trades) {
        return analyzeTrades(trades, diagnosticSink);
    }

    /**
     * Analyzes the full trade set, sending matching diagnostics to {@code sink}.
     *
     * @throws com.traderank.exception.TradeValidationException if a fill fails a precondition
     */
    public TradingSummary analyzeTrades(Collection<TradeRecord> trades, MatchDiagnosticSink sink) {
        long startNanos = System.nanoTime();
        TradePreconditions.checkAll(trades);

        Map<LocalDate, List<TradeRecord>> byDate = TradeGrouping.byDate(trades);
        log.info("Analyzing {} trades across {} trading days", trades.size(), byDate.size());

        List<DailySummary> dailySummaries = analyticsProperties.isParallel()
                ? calculateDailyInParallel(byDate, sink)
                : calculateDailySequentially(byDate, sink);

        List<WeeklySummary> weeklySummaries = weeklySummaryAggregator.aggregate(dailySummaries);
        TradingSummary summary = buildSummary(dailySummaries, weeklySummaries);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        log.info(
                "Analysis complete: days={}, weeks={}, trades={}, pnl={}, winRate={}%, took {}ms",
                dailySummaries.size(),
                weeklySummaries.size(),
                summary.getTotalTrades(),
                summary.getTotalPnl(),
                String.format("%.1f", summary.getOverallWinRate()),
                durationMs);

        eventPublisherHelper.publishTradingSummary(this, summary, trades.size(), durationMs);
        return summary;
    }

    /**
     * Ranks the configured time-of-day windows by net P&L, best first. Independent of
     * {@link #analyzeTrades}; the result is not part of the trading summary.
     */
    public List<TradingPeriod> identifyBestTradingPeriods(Collection<TradeRecord> trades) {
        return tradingPeriodAnalyzer.identifyBestTradingPeriods(trades);
    }

    private List<DailySummary> calculateDailySequentially(
            Map<LocalDate, List<TradeRecord>> byDate, MatchDiagnosticSink sink) {
        List<DailySummary> summaries = new ArrayList<>(byDate.size());
        for (Map.Entry<LocalDate, List<TradeRecord>> entry : byDate.entrySet()) {
            summaries.add(dailySummaryCalculator.calculate(entry.getKey(), entry.getValue(), sink));
        }
        return summaries;
    }

    private List<DailySummary> calculateDailyInParallel(
            Map<LocalDate, List<TradeRecord>> byDate, MatchDiagnosticSink sink) {
        List<CompletableFuture<DailySummary>> futures = new ArrayList<>(byDate.size());
        for (Map.Entry<LocalDate, List<TradeRecord>> entry : byDate.entrySet()) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> dailySummaryCalculator.calculate(entry.getKey(), entry.getValue(), sink),
                    analyticsExecutor));
        }

        // byDate is sorted, so joining in submission order keeps the result date-ascending
        List<DailySummary> summaries = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<DailySummary> future : futures) {
                summaries.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof BaseException baseException) {
                throw baseException;
            }
            throw new AnalyticsException("Daily summary computation failed", e.getCause());
        }
        return summaries;
    }

    private TradingSummary buildSummary(List<DailySummary> dailySummaries, List<WeeklySummary> weeklySummaries) {
        if (dailySummaries.isEmpty()) {
            LocalDate today = LocalDate.now(ZoneOffset.UTC);
            return TradingSummary.builder()
                    .startDate(today)
                    .endDate(today)
                    .totalPnl(BigDecimal.ZERO)
                    .totalVolume(BigDecimal.ZERO)
                    .totalTrades(0)
                    .overallWinRate(0.0)
                    .build();
        }

        BigDecimal totalPnl = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        int totalTrades = 0;
        int totalWins = 0;
        for (DailySummary daily : dailySummaries) {
            totalPnl = totalPnl.add(daily.getRealizedPnl());
            totalVolume = totalVolume.add(daily.getTotalVolume());
            totalTrades += daily.getTotalTrades();
            totalWins += daily.getWinningTrades();
        }

        List<HourPnL> hourTotals = sumHourlyPnl(dailySummaries);

        return TradingSummary.builder()
                .startDate(dailySummaries.get(0).getDate())
                .endDate(dailySummaries.get(dailySummaries.size() - 1).getDate())
                .dailySummaries(dailySummaries)
                .weeklySummaries(weeklySummaries)
                .totalPnl(totalPnl)
                .totalVolume(totalVolume)
                .totalTrades(totalTrades)
                .overallWinRate(PerformanceMetrics.winRate(totalWins, totalTrades))
                .bestDay(PerformanceMetrics.firstMax(dailySummaries, DailySummary::getRealizedPnl)
                        .map(d -> new DayPnL(d.getDate(), d.getRealizedPnl()))
                        .orElse(null))
                .worstDay(PerformanceMetrics.firstMin(dailySummaries, DailySummary::getRealizedPnl)
                        .map(d -> new DayPnL(d.getDate(), d.getRealizedPnl()))
                        .orElse(null))
                .bestWeek(PerformanceMetrics.firstMax(weeklySummaries, WeeklySummary::getRealizedPnl)
                        .map(w -> new WeekPnL(w.getIsoYear(), w.getWeekNumber(), w.getRealizedPnl()))
                        .orElse(null))
                .worstWeek(PerformanceMetrics.firstMin(weeklySummaries, WeeklySummary::getRealizedPnl)
                        .map(w -> new WeekPnL(w.getIsoYear(), w.getWeekNumber(), w.getRealizedPnl()))
                        .orElse(null))
                .mostProfitableHour(PerformanceMetrics.firstMax(hourTotals, HourPnL::getPnl).orElse(null))
                .leastProfitableHour(PerformanceMetrics.firstMin(hourTotals, HourPnL::getPnl).orElse(null))
                .build();
    }

    /** Sums each hour's P&L across every day; only hours active on some day appear. Ascending by hour. */
    private List<HourPnL> sumHourlyPnl(List<DailySummary> dailySummaries) {
        Map<Integer, BigDecimal> totals = new TreeMap<>();
        for (DailySummary daily : dailySummaries) {
            for (TimeSlotPerformance slot : daily.getTimeSlotPerformance()) {
                totals.merge(slot.getHour(), slot.getPnl(), BigDecimal::add);
            }
        }
        List<HourPnL> hours = new ArrayList<>(totals.size());
        totals.forEach((hour, pnl) -> hours.add(new HourPnL(hour, pnl)));
        return hours;
    }
}
