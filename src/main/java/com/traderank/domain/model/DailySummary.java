package com.traderank.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Data;

/**
 * Realized performance for one calendar day (UTC).
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code grossPnl == realizedPnl + totalCommission}</li>
 *   <li>{@code totalTrades == winningTrades + losingTrades}; flat round trips count toward neither</li>
 *   <li>{@code winRate == winningTrades / totalTrades * 100}, or 0 with no trades</li>
 * </ul>
 *
 * <p>{@code realizedPnl} is net of every commission paid that day, including commission
 * on fills that never formed a round trip.
 */
@Data
@Builder
public class DailySummary {

    private LocalDate date;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    private BigDecimal realizedPnl;
    private BigDecimal grossPnl;
    private BigDecimal totalCommission;

    /** Sum of quantity * fill price over every fill of the day, both legs. */
    private BigDecimal totalVolume;

    private double winRate;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal largestWin;
    private BigDecimal largestLoss;

    /** Instruments that formed at least one matching attempt, sorted. */
    @Builder.Default
    private List<String> symbolsTraded = new ArrayList<>();

    /** Hours with activity only, ascending by hour. */
    @Builder.Default
    private List<TimeSlotPerformance> timeSlotPerformance = new ArrayList<>();

    /** UTC midnight at the start of {@link #getDate()}. */
    public Instant getStartOfDay() {
        return date.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public Optional<BigDecimal> profitFactor() {
        return ProfitFactors.of(avgWin, winningTrades, avgLoss, losingTrades);
    }
}
