package com.traderank.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Activity and realized P&L within one hour-of-day bucket of a single day.
 *
 * <p>{@code trades} counts fills executed in the hour, matched or not. {@code pnl} only
 * includes round trips opened and closed inside the hour, net of each closing fill's
 * commission.
 */
@Data
@Builder
public class TimeSlotPerformance {

    private int hour;
    private int trades;
    private BigDecimal pnl;

    /** wins / (wins + losses) * 100; 0 when no round trip in the hour was decided. */
    private double winRate;
}
