package com.traderank.analytics;

import com.traderank.domain.model.TradeRecord;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over fills used before any position matching.
 *
 * <p>Execution time decides; fills sharing a timestamp fall back to side (BUY first),
 * then price, quantity, net amount and commission. Two runs over the same set of fills
 * therefore match them in the same sequence whatever order the caller supplied.
 */
public final class TradeOrdering {

    public static final Comparator<TradeRecord> CHRONOLOGICAL = Comparator.comparing(TradeRecord::getExecutedAt)
            .thenComparing(TradeRecord::getSide)
            .thenComparing(TradeRecord::getFillPrice)
            .thenComparing(TradeRecord::getQuantity)
            .thenComparing(TradeRecord::getNetAmount)
            .thenComparing(TradeRecord::getCommission);

    private TradeOrdering() {}

    /** Returns a new list holding {@code trades} in {@link #CHRONOLOGICAL} order. */
    public static List<TradeRecord> chronological(List<TradeRecord> trades) {
        return trades.stream().sorted(CHRONOLOGICAL).toList();
    }
}
