package com.traderank.diagnostics;

import com.traderank.domain.model.MatchDiagnostic;

/**
 * Receives matching anomalies as they are detected.
 *
 * <p>Implementations must not throw: a diagnostic never aborts an analysis run.
 * When daily summaries are computed in parallel, {@link #report} may be called from
 * several threads at once.
 */
@FunctionalInterface
public interface MatchDiagnosticSink {

    MatchDiagnosticSink NO_OP = diagnostic -> {};

    void report(MatchDiagnostic diagnostic);
}
