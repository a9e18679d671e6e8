package com.traderank.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Output of matching one instrument's fills within one scope.
 *
 * <p>{@code realizedPnls} holds one entry per closed round-trip portion, in fill order.
 * A zero entry is a flat round trip: it is neither a win nor a loss.
 */
@Value
@Builder
public class MatchResult {

    String symbol;
    List<BigDecimal> realizedPnls;
    OpenPosition residualPosition;
    List<MatchDiagnostic> diagnostics;

    /** True when fewer than two fills were supplied and no matching was attempted. */
    boolean unmatched;

    public int getRoundTripCount() {
        return realizedPnls.size();
    }

    public BigDecimal getTotalRealized() {
        return realizedPnls.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
