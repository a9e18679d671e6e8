package com.traderank.domain.model;

import com.traderank.domain.enums.DiagnosticType;
import com.traderank.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Structured record of a non-fatal matching anomaly.
 *
 * <p>{@code side} and {@code price} are only populated for {@link DiagnosticType#UNMATCHED},
 * where they describe the lone fill. {@code quantity} is the number of shares involved:
 * the lone fill's size, the dropped oversell excess, or the absolute residual position.
 */
@Value
@Builder
public class MatchDiagnostic {

    DiagnosticType type;
    String symbol;
    LocalDate date;
    BigDecimal quantity;
    TradeSide side;
    BigDecimal price;
    String message;
}
