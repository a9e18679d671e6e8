package com.traderank.observability;

import com.traderank.domain.model.MatchDiagnostic;
import com.traderank.event.MatchDiagnosticEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Operator-visible channel for matching anomalies: one WARN line per diagnostic.
 */
@Component
public class DiagnosticLogListener {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticLogListener.class);

    @EventListener
    public void onMatchDiagnostic(MatchDiagnosticEvent event) {
        MatchDiagnostic diagnostic = event.getDiagnostic();
        log.warn("[{}] {} {}", diagnostic.getType(), diagnostic.getDate(), diagnostic.getMessage());
    }
}
