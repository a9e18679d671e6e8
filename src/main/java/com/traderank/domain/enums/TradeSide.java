package com.traderank.domain.enums;

import java.util.Locale;

/** Buy or sell side of an executed fill. */
public enum TradeSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Resolves a broker side label. Accepts "buy"/"long" and "sell"/"short", case-insensitive.
     *
     * @throws IllegalArgumentException for any other label
     */
    public static TradeSide fromString(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Trade side label is null");
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "long" -> BUY;
            case "sell", "short" -> SELL;
            default -> throw new IllegalArgumentException("Invalid side: " + label);
        };
    }
}
