package com.traderank.analytics;

import com.traderank.diagnostics.MatchDiagnosticSink;
import com.traderank.domain.enums.CommissionAttribution;
import com.traderank.domain.enums.DiagnosticType;
import com.traderank.domain.enums.TradeSide;
import com.traderank.domain.model.MatchDiagnostic;
import com.traderank.domain.model.MatchResult;
import com.traderank.domain.model.OpenPosition;
import com.traderank.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one instrument's fills within one scope (a day, or an hour of a day) into realized
 * round-trip P&L using average-cost position tracking.
 *
 * <p>State is a signed position (positive = long, negative = short) and a volume-weighted
 * average entry price:
 * <ul>
 *   <li><b>Buy against a short:</b> closes {@code min(qty, -position)} and realizes
 *       {@code (avgPrice - fillPrice) * closed}. Any remainder opens a long at the fill price.</li>
 *   <li><b>Buy when flat or long:</b> opens at the fill price, or blends into the average:
 *       {@code (avg * pos + price * qty) / (pos + qty)}.</li>
 *   <li><b>Sell against a long:</b> closes {@code min(qty, position)} and realizes
 *       {@code (fillPrice - avgPrice) * closed}. The excess is dropped and reported as an
 *       oversell; it never opens a short.</li>
 *   <li><b>Sell when flat or short:</b> opens or extends a short, mirroring the buy side.</li>
 * </ul>
 * Closing to exactly zero resets the average price to zero.
 *
 * <p>With fewer than two fills no matching is attempted and the lone fill is reported as
 * unmatched. A non-zero position after the last fill is reported as unclosed. Neither
 * condition throws; every anomaly goes to the supplied {@link MatchDiagnosticSink}.
 *
 * <p>Stateless and thread-safe: all position state lives on the stack of {@link #match}.
 */
@Component
public class PositionMatcher {

    private static final Logger log = LoggerFactory.getLogger(PositionMatcher.class);

    /**
     * Matches the given fills of a single instrument.
     *
     * @param symbol      the instrument all fills belong to
     * @param scopeDate   the day being analyzed, used to label diagnostics
     * @param fills       fills of {@code symbol} within the scope, in any order
     * @param attribution whether each realized amount carries its closing fill's commission
     * @param sink        receives unmatched / oversell / unclosed diagnostics
     * @return realized amounts in fill order plus the residual position
     */
    public MatchResult match(
            String symbol,
            LocalDate scopeDate,
            List<TradeRecord> fills,
            CommissionAttribution attribution,
            MatchDiagnosticSink sink) {

        List<MatchDiagnostic> diagnostics = new ArrayList<>();

        if (fills.size() < 2) {
            if (fills.size() == 1) {
                TradeRecord lone = fills.get(0);
                emit(sink, diagnostics, MatchDiagnostic.builder()
                        .type(DiagnosticType.UNMATCHED)
                        .symbol(symbol)
                        .date(scopeDate)
                        .quantity(lone.getQuantity())
                        .side(lone.getSide())
                        .price(lone.getFillPrice())
                        .message(String.format(
                                "Unmatched trade for %s: %s %s shares at %s",
                                symbol, lone.getSide(), lone.getQuantity().toPlainString(),
                                lone.getFillPrice().toPlainString()))
                        .build());
            }
            return MatchResult.builder()
                    .symbol(symbol)
                    .realizedPnls(List.of())
                    .residualPosition(OpenPosition.flat())
                    .diagnostics(List.copyOf(diagnostics))
                    .unmatched(true)
                    .build();
        }

        List<TradeRecord> ordered = TradeOrdering.chronological(fills);
        List<BigDecimal> realized = new ArrayList<>();

        BigDecimal position = BigDecimal.ZERO;
        BigDecimal avgPrice = BigDecimal.ZERO;

        for (TradeRecord fill : ordered) {
            BigDecimal qty = fill.getQuantity();
            BigDecimal price = fill.getFillPrice();

            if (fill.getSide() == TradeSide.BUY) {
                if (position.signum() < 0) {
                    // Covering a short
                    BigDecimal toClose = qty.min(position.negate());
                    if (toClose.signum() > 0) {
                        BigDecimal pnl = avgPrice.subtract(price).multiply(toClose);
                        realized.add(chargeCommission(pnl, fill, attribution));
                        position = position.add(toClose);
                    }
                    BigDecimal remaining = qty.subtract(toClose);
                    if (remaining.signum() > 0) {
                        position = remaining;
                        avgPrice = price;
                    } else if (position.signum() == 0) {
                        avgPrice = BigDecimal.ZERO;
                    }
                } else if (position.signum() == 0) {
                    position = qty;
                    avgPrice = price;
                } else {
                    BigDecimal totalValue = avgPrice.multiply(position).add(price.multiply(qty));
                    position = position.add(qty);
                    avgPrice = totalValue.divide(position, MathContext.DECIMAL128);
                }
            } else {
                if (position.signum() > 0) {
                    // Closing a long
                    BigDecimal toClose = qty.min(position);
                    if (toClose.signum() > 0) {
                        BigDecimal pnl = price.subtract(avgPrice).multiply(toClose);
                        realized.add(chargeCommission(pnl, fill, attribution));
                        position = position.subtract(toClose);
                    }
                    BigDecimal excess = qty.subtract(toClose);
                    if (excess.signum() > 0) {
                        emit(sink, diagnostics, MatchDiagnostic.builder()
                                .type(DiagnosticType.OVERSELL)
                                .symbol(symbol)
                                .date(scopeDate)
                                .quantity(excess)
                                .message(String.format(
                                        "%s - Selling %s more shares than owned (had %s shares)",
                                        symbol, excess.toPlainString(), toClose.toPlainString()))
                                .build());
                    }
                    if (position.signum() == 0) {
                        avgPrice = BigDecimal.ZERO;
                    }
                } else if (position.signum() == 0) {
                    position = qty.negate();
                    avgPrice = price;
                } else {
                    BigDecimal shortQty = position.negate();
                    BigDecimal totalValue = avgPrice.multiply(shortQty).add(price.multiply(qty));
                    position = position.subtract(qty);
                    avgPrice = totalValue.divide(position.negate(), MathContext.DECIMAL128);
                }
            }
        }

        if (position.signum() != 0) {
            boolean isLong = position.signum() > 0;
            emit(sink, diagnostics, MatchDiagnostic.builder()
                    .type(isLong ? DiagnosticType.UNCLOSED_LONG : DiagnosticType.UNCLOSED_SHORT)
                    .symbol(symbol)
                    .date(scopeDate)
                    .quantity(position.abs())
                    .message(String.format(
                            "%s - Unclosed %s position of %s shares",
                            symbol, isLong ? "long" : "short", position.abs().toPlainString()))
                    .build());
        }

        log.debug(
                "Matched {} fills for {} on {}: {} round trips, residual={}",
                ordered.size(), symbol, scopeDate, realized.size(), position.toPlainString());

        return MatchResult.builder()
                .symbol(symbol)
                .realizedPnls(List.copyOf(realized))
                .residualPosition(new OpenPosition(position, avgPrice))
                .diagnostics(List.copyOf(diagnostics))
                .unmatched(false)
                .build();
    }

    private BigDecimal chargeCommission(BigDecimal pnl, TradeRecord closingFill, CommissionAttribution attribution) {
        return attribution == CommissionAttribution.PER_CLOSING_FILL
                ? pnl.subtract(closingFill.getCommission())
                : pnl;
    }

    private void emit(MatchDiagnosticSink sink, List<MatchDiagnostic> collected, MatchDiagnostic diagnostic) {
        collected.add(diagnostic);
        sink.report(diagnostic);
    }
}
