package com.traderank.domain.model;

import com.traderank.domain.vo.DayPnL;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Data;

/**
 * Performance for one ISO week, folded from the week's {@link DailySummary} entries.
 *
 * <p>The (isoYear, weekNumber) pair identifies the week. The window runs from Monday
 * 00:00:00 UTC to Sunday 23:59:59 UTC. Every aggregate here can be recomputed from
 * {@code dailySummaries}; average win/loss are weighted by each day's trade counts.
 */
@Data
@Builder
public class WeeklySummary {

    private int weekNumber;
    private int isoYear;
    private Instant startDate;
    private Instant endDate;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    private BigDecimal realizedPnl;
    private BigDecimal grossPnl;
    private BigDecimal totalCommission;
    private BigDecimal totalVolume;

    private double winRate;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal largestWin;
    private BigDecimal largestLoss;

    /** Day with the highest realized P&L; earliest day on ties. Null for an empty week. */
    private DayPnL bestDay;

    /** Day with the lowest realized P&L; earliest day on ties. Null for an empty week. */
    private DayPnL worstDay;

    private int tradingDays;
    private int profitableDays;
    private BigDecimal avgDailyPnl;

    @Builder.Default
    private List<String> symbolsTraded = new ArrayList<>();

    /** Contained days, ascending by date. */
    @Builder.Default
    private List<DailySummary> dailySummaries = new ArrayList<>();

    public Optional<BigDecimal> profitFactor() {
        return ProfitFactors.of(avgWin, winningTrades, avgLoss, losingTrades);
    }
}
