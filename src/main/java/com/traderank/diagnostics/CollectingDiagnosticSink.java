package com.traderank.diagnostics;

import com.traderank.domain.enums.DiagnosticType;
import com.traderank.domain.model.MatchDiagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps every diagnostic in memory, in arrival order.
 * Used by callers that want to inspect a run's anomalies after it completes.
 */
public class CollectingDiagnosticSink implements MatchDiagnosticSink {

    private final List<MatchDiagnostic> diagnostics = new CopyOnWriteArrayList<>();

    @Override
    public void report(MatchDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<MatchDiagnostic> getDiagnostics() {
        return new ArrayList<>(diagnostics);
    }

    public List<MatchDiagnostic> ofType(DiagnosticType type) {
        return diagnostics.stream().filter(d -> d.getType() == type).toList();
    }

    public void clear() {
        diagnostics.clear();
    }
}
