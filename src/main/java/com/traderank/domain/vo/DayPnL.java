package com.traderank.domain.vo;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** Realized P&L attributed to one calendar day (UTC). */
@Value
public class DayPnL {

    LocalDate date;
    BigDecimal pnl;
}
