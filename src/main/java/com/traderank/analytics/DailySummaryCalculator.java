package com.traderank.analytics;

import com.traderank.diagnostics.MatchDiagnosticSink;
import com.traderank.domain.enums.CommissionAttribution;
import com.traderank.domain.model.DailySummary;
import com.traderank.domain.model.MatchResult;
import com.traderank.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link DailySummary} for one calendar day.
 *
 * <p>Fills are partitioned by instrument and each partition goes through
 * {@link PositionMatcher} with the day as scope. The realized amounts of all instruments
 * are then folded:
 * <ul>
 *   <li>strictly positive -> win (count, sum, max)</li>
 *   <li>strictly negative -> loss (count, sum, min)</li>
 *   <li>zero -> neither, but still part of the P&L sum</li>
 * </ul>
 * Commission and notional volume are summed over every fill of the day, including
 * instruments with a single unmatched fill. Commission is subtracted once from the
 * realized total rather than per round trip.
 */
@Service
public class DailySummaryCalculator {

    private static final Logger log = LoggerFactory.getLogger(DailySummaryCalculator.class);

    private final PositionMatcher positionMatcher;
    private final HourlyPerformanceCalculator hourlyPerformanceCalculator;

    public DailySummaryCalculator(
            PositionMatcher positionMatcher, HourlyPerformanceCalculator hourlyPerformanceCalculator) {
        this.positionMatcher = positionMatcher;
        this.hourlyPerformanceCalculator = hourlyPerformanceCalculator;
    }

    /**
     * Computes the summary for {@code date} from that day's fills.
     *
     * @param date      the UTC calendar date
     * @param dayTrades every fill executed on {@code date}; may be empty
     * @param sink      receives matching diagnostics for the day
     */
    public DailySummary calculate(LocalDate date, List<TradeRecord> dayTrades, MatchDiagnosticSink sink) {
        BigDecimal totalCommission = BigDecimal.ZERO;
        BigDecimal totalVolume = BigDecimal.ZERO;
        List<BigDecimal> realized = new ArrayList<>();
        List<String> symbols = new ArrayList<>();

        for (Map.Entry<String, List<TradeRecord>> entry :
                TradeGrouping.bySymbol(dayTrades).entrySet()) {
            List<TradeRecord> fills = entry.getValue();
            for (TradeRecord fill : fills) {
                totalCommission = totalCommission.add(fill.getCommission());
                totalVolume = totalVolume.add(fill.notional());
            }

            MatchResult result = positionMatcher.match(
                    entry.getKey(), date, fills, CommissionAttribution.AGGREGATE, sink);
            if (!result.isUnmatched()) {
                symbols.add(entry.getKey());
            }
            realized.addAll(result.getRealizedPnls());
        }

        int winning = 0;
        int losing = 0;
        BigDecimal winSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;
        BigDecimal realizedSum = BigDecimal.ZERO;

        for (BigDecimal pnl : realized) {
            if (pnl.signum() > 0) {
                winning++;
                winSum = winSum.add(pnl);
                largestWin = largestWin.max(pnl);
            } else if (pnl.signum() < 0) {
                losing++;
                lossSum = lossSum.add(pnl);
                largestLoss = largestLoss.min(pnl);
            }
            realizedSum = realizedSum.add(pnl);
        }

        BigDecimal realizedPnl = realizedSum.subtract(totalCommission);
        int totalTrades = winning + losing;

        DailySummary summary = DailySummary.builder()
                .date(date)
                .totalTrades(totalTrades)
                .winningTrades(winning)
                .losingTrades(losing)
                .realizedPnl(realizedPnl)
                .grossPnl(realizedPnl.add(totalCommission))
                .totalCommission(totalCommission)
                .totalVolume(totalVolume)
                .winRate(PerformanceMetrics.winRate(winning, totalTrades))
                .avgWin(PerformanceMetrics.average(winSum, winning))
                .avgLoss(PerformanceMetrics.average(lossSum, losing))
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .symbolsTraded(symbols)
                .timeSlotPerformance(hourlyPerformanceCalculator.calculate(date, dayTrades))
                .build();

        log.debug(
                "Daily summary {}: fills={}, roundTrips={}, realized={}, commission={}",
                date, dayTrades.size(), realized.size(), realizedPnl, totalCommission);

        return summary;
    }
}
