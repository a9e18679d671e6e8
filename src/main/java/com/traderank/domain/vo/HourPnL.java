package com.traderank.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** P&L summed for one hour of day (0-23, UTC) across all analyzed days. */
@Value
public class HourPnL {

    int hour;
    BigDecimal pnl;
}
