package com.traderank.event;

import com.traderank.domain.model.MatchDiagnostic;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every non-fatal anomaly found while matching fills into round trips
 * (unmatched single fill, oversell, unclosed position).
 *
 * <p>Key listeners:
 * <ul>
 *   <li>DiagnosticLogListener: writes an operator-visible WARN line</li>
 *   <li>AnalyticsMetricsService: counts diagnostics by type</li>
 * </ul>
 */
public class MatchDiagnosticEvent extends ApplicationEvent {

    private final MatchDiagnostic diagnostic;
    private final LocalDateTime detectedAt;

    public MatchDiagnosticEvent(Object source, MatchDiagnostic diagnostic) {
        super(source);
        this.diagnostic = diagnostic;
        this.detectedAt = LocalDateTime.now();
    }

    public MatchDiagnostic getDiagnostic() {
        return diagnostic;
    }

    public LocalDateTime getDetectedAt() {
        return detectedAt;
    }
}
