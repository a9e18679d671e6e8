package com.traderank.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** Realized P&L attributed to one ISO week, identified by (ISO year, ISO week number). */
@Value
public class WeekPnL {

    int isoYear;
    int weekNumber;
    BigDecimal pnl;
}
