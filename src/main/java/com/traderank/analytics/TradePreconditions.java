package com.traderank.analytics;

import com.traderank.domain.model.TradeRecord;
import com.traderank.exception.TradeValidationException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fail-fast guard run before any computation. Input is expected to be validated
 * upstream; this only stops bypassed validation from silently producing wrong P&L.
 */
public final class TradePreconditions {

    private TradePreconditions() {}

    public static void checkAll(Collection<TradeRecord> trades) {
        if (trades == null) {
            throw new TradeValidationException("Trade collection must not be null");
        }
        int index = 0;
        for (TradeRecord trade : trades) {
            check(trade, index++);
        }
    }

    static void check(TradeRecord trade, int index) {
        if (trade == null) {
            throw invalid("Trade record is null", index, null);
        }
        if (trade.getSymbol() == null || trade.getSymbol().isBlank()) {
            throw invalid("Symbol must not be blank", index, trade);
        }
        if (trade.getSide() == null) {
            throw invalid("Side is missing", index, trade);
        }
        if (trade.getExecutedAt() == null) {
            throw invalid("Execution time is missing", index, trade);
        }
        if (trade.getQuantity() == null || trade.getQuantity().signum() <= 0) {
            throw invalid("Quantity must be positive", index, trade);
        }
        if (trade.getFillPrice() == null || trade.getFillPrice().signum() < 0) {
            throw invalid("Fill price must not be negative", index, trade);
        }
        if (trade.getCommission() == null || trade.getCommission().signum() < 0) {
            throw invalid("Commission must not be negative", index, trade);
        }
        if (trade.getNetAmount() == null) {
            throw invalid("Net amount is missing", index, trade);
        }
    }

    private static TradeValidationException invalid(String reason, int index, TradeRecord trade) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("index", index);
        if (trade != null) {
            details.put("symbol", String.valueOf(trade.getSymbol()));
            details.put("quantity", valueOf(trade.getQuantity()));
            details.put("fillPrice", valueOf(trade.getFillPrice()));
            details.put("commission", valueOf(trade.getCommission()));
        }
        return new TradeValidationException(reason + " (trade #" + index + ")", details);
    }

    private static String valueOf(BigDecimal value) {
        return value == null ? "null" : value.toPlainString();
    }
}
