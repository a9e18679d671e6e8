package com.traderank.domain.enums;

/**
 * Non-fatal anomalies detected while matching fills into round trips.
 *
 * <p>None of these abort an analysis run. They are reported through a
 * {@link com.traderank.diagnostics.MatchDiagnosticSink} and the run continues.
 */
public enum DiagnosticType {

    /** Instrument had a single fill in the scope, so no round trip could be formed. */
    UNMATCHED,

    /** A sell exceeded the open long quantity; the excess was dropped. */
    OVERSELL,

    /** Long quantity still open after the last fill of the scope. */
    UNCLOSED_LONG,

    /** Short quantity still open after the last fill of the scope. */
    UNCLOSED_SHORT
}
