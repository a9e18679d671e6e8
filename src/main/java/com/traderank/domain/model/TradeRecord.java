package com.traderank.domain.model;

import com.traderank.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A single executed fill, already parsed and validated by the ingestion layer.
 *
 * <p>{@code netAmount} is the amount the broker reports for the fill before commission:
 * paid for a buy, received for a sell. {@link #grossPnl()} turns it into a signed cash
 * effect (negative for buys) so that a fill's own contribution can be summed directly.
 *
 * <p>Identity for deduplication is (symbol, side, quantity, fillPrice, executedAt).
 * Decimal fields are compared by numeric value, so {@code 100} and {@code 100.00} are
 * the same quantity. {@code netAmount} and {@code commission} are not part of identity.
 */
@Getter
@Builder
@ToString
public class TradeRecord {

    private final String symbol;
    private final TradeSide side;
    private final BigDecimal quantity;
    private final BigDecimal fillPrice;

    /** Execution time, UTC, second precision. */
    private final Instant executedAt;

    private final BigDecimal netAmount;
    private final BigDecimal commission;

    /** Cash effect of this fill alone: {@code -netAmount} for buys, {@code netAmount} for sells. */
    public BigDecimal grossPnl() {
        return side == TradeSide.BUY ? netAmount.negate() : netAmount;
    }

    /** {@link #grossPnl()} minus this fill's commission. */
    public BigDecimal netPnl() {
        return grossPnl().subtract(commission);
    }

    /** Gross notional of the fill: quantity * fill price. */
    public BigDecimal notional() {
        return quantity.multiply(fillPrice);
    }

    /** Hour of day (0-23) of the execution time in UTC. */
    public int hourOfDay() {
        return executedAt.atOffset(ZoneOffset.UTC).getHour();
    }

    /** Calendar date of the execution time in UTC. */
    public LocalDate tradeDate() {
        return executedAt.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TradeRecord other)) {
            return false;
        }
        return Objects.equals(symbol, other.symbol)
                && side == other.side
                && sameValue(quantity, other.quantity)
                && sameValue(fillPrice, other.fillPrice)
                && Objects.equals(executedAt, other.executedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, side, normalized(quantity), normalized(fillPrice), executedAt);
    }

    private static boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    private static BigDecimal normalized(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros();
    }
}
