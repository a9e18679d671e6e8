package com.traderank.domain.enums;

/**
 * How commission is charged against realized round-trip amounts during position matching.
 */
public enum CommissionAttribution {

    /**
     * Realized amounts are pure price differences. The caller subtracts the scope's total
     * commission once (daily summaries).
     */
    AGGREGATE,

    /** Each realized amount is reduced by the commission of the fill that closed it (hourly buckets). */
    PER_CLOSING_FILL
}
