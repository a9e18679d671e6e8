package com.traderank.analytics;

import com.traderank.domain.model.TradeRecord;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure grouping functions. Each call returns a fresh sorted map; nothing is cached
 * between calls. Lists inside each group keep the caller's iteration order.
 */
public final class TradeGrouping {

    private TradeGrouping() {}

    /** Groups fills by UTC calendar date, ascending. */
    public static Map<LocalDate, List<TradeRecord>> byDate(Collection<TradeRecord> trades) {
        Map<LocalDate, List<TradeRecord>> grouped = new TreeMap<>();
        for (TradeRecord trade : trades) {
            grouped.computeIfAbsent(trade.tradeDate(), k -> new ArrayList<>()).add(trade);
        }
        return grouped;
    }

    /** Groups fills by instrument symbol, alphabetical. */
    public static Map<String, List<TradeRecord>> bySymbol(Collection<TradeRecord> trades) {
        Map<String, List<TradeRecord>> grouped = new TreeMap<>();
        for (TradeRecord trade : trades) {
            grouped.computeIfAbsent(trade.getSymbol(), k -> new ArrayList<>()).add(trade);
        }
        return grouped;
    }

    /** Groups fills by UTC hour of day (0-23), ascending. */
    public static Map<Integer, List<TradeRecord>> byHour(Collection<TradeRecord> trades) {
        Map<Integer, List<TradeRecord>> grouped = new TreeMap<>();
        for (TradeRecord trade : trades) {
            grouped.computeIfAbsent(trade.hourOfDay(), k -> new ArrayList<>()).add(trade);
        }
        return grouped;
    }
}
