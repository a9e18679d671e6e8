package com.traderank.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Residual position left after matching one instrument's fills within a scope.
 *
 * <p>Quantity is signed: positive = long, negative = short. Never persisted; a new
 * position starts flat at the beginning of every day and every hour bucket.
 */
@Value
public class OpenPosition {

    BigDecimal quantity;
    BigDecimal averagePrice;

    public static OpenPosition flat() {
        return new OpenPosition(BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean isFlat() {
        return quantity.signum() == 0;
    }

    public boolean isLong() {
        return quantity.signum() > 0;
    }

    public boolean isShort() {
        return quantity.signum() < 0;
    }
}
