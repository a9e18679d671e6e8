package com.traderank.analytics;

import com.traderank.diagnostics.MatchDiagnosticSink;
import com.traderank.domain.enums.CommissionAttribution;
import com.traderank.domain.model.MatchResult;
import com.traderank.domain.model.TimeSlotPerformance;
import com.traderank.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Breaks one day's fills into hour-of-day buckets (UTC) and re-runs position matching
 * inside each bucket, independently per instrument.
 *
 * <p>Positions do not carry across buckets: a round trip opened at 09:30 and closed at
 * 10:15 realizes nothing in either hour, although both fills count toward their hour's
 * trade count. Each realized amount is net of its closing fill's commission.
 *
 * <p>Matching anomalies are not reported from here; the daily pass over the same fills
 * already reports them.
 */
@Service
public class HourlyPerformanceCalculator {

    private final PositionMatcher positionMatcher;

    public HourlyPerformanceCalculator(PositionMatcher positionMatcher) {
        this.positionMatcher = positionMatcher;
    }

    /**
     * Computes per-hour performance for a single day's fills.
     *
     * @param date      the day the fills belong to
     * @param dayTrades all fills of that day
     * @return one entry per hour with at least one fill, ascending by hour
     */
    public List<TimeSlotPerformance> calculate(LocalDate date, List<TradeRecord> dayTrades) {
        List<TimeSlotPerformance> slots = new ArrayList<>();

        for (Map.Entry<Integer, List<TradeRecord>> hourEntry :
                TradeGrouping.byHour(dayTrades).entrySet()) {
            int hour = hourEntry.getKey();
            int fillCount = hourEntry.getValue().size();
            BigDecimal hourPnl = BigDecimal.ZERO;
            int wins = 0;
            int losses = 0;

            for (Map.Entry<String, List<TradeRecord>> symbolEntry :
                    TradeGrouping.bySymbol(hourEntry.getValue()).entrySet()) {
                if (symbolEntry.getValue().size() < 2) {
                    continue;
                }
                MatchResult result = positionMatcher.match(
                        symbolEntry.getKey(),
                        date,
                        symbolEntry.getValue(),
                        CommissionAttribution.PER_CLOSING_FILL,
                        MatchDiagnosticSink.NO_OP);

                for (BigDecimal pnl : result.getRealizedPnls()) {
                    hourPnl = hourPnl.add(pnl);
                    if (pnl.signum() > 0) {
                        wins++;
                    } else if (pnl.signum() < 0) {
                        losses++;
                    }
                }
            }

            slots.add(TimeSlotPerformance.builder()
                    .hour(hour)
                    .trades(fillCount)
                    .pnl(hourPnl)
                    .winRate(PerformanceMetrics.winRate(wins, wins + losses))
                    .build());
        }

        return slots;
    }
}
