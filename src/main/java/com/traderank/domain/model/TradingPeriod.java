package com.traderank.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate of fills executed inside a named wall-clock window (e.g. "Morning", 10-12).
 *
 * <p>Hours are UTC, start inclusive, end exclusive. Not tied to any date: every fill in
 * the analyzed set whose hour falls in the window contributes its own net P&L.
 */
@Data
@Builder
public class TradingPeriod {

    private String name;
    private int startHour;
    private int endHour;
    private int totalTrades;
    private BigDecimal totalPnl;
    private double winRate;
    private BigDecimal avgPnlPerTrade;

    public boolean containsHour(int hour) {
        return hour >= startHour && hour < endHour;
    }
}
