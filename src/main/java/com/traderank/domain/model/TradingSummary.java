package com.traderank.domain.model;

import com.traderank.domain.vo.DayPnL;
import com.traderank.domain.vo.HourPnL;
import com.traderank.domain.vo.WeekPnL;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Full-period result of one analysis run.
 *
 * <p>Daily entries are ascending by date and weekly entries ascending by week start.
 * Extremum fields are null when there is nothing to rank. For an empty trade set,
 * {@code startDate} and {@code endDate} are the current UTC date.
 */
@Data
@Builder
public class TradingSummary {

    private LocalDate startDate;
    private LocalDate endDate;

    @Builder.Default
    private List<DailySummary> dailySummaries = new ArrayList<>();

    @Builder.Default
    private List<WeeklySummary> weeklySummaries = new ArrayList<>();

    private BigDecimal totalPnl;
    private BigDecimal totalVolume;
    private int totalTrades;
    private double overallWinRate;

    private DayPnL bestDay;
    private DayPnL worstDay;
    private WeekPnL bestWeek;
    private WeekPnL worstWeek;
    private HourPnL mostProfitableHour;
    private HourPnL leastProfitableHour;

    public boolean isEmpty() {
        return dailySummaries == null || dailySummaries.isEmpty();
    }
}
