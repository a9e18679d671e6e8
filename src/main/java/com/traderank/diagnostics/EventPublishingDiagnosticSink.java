package com.traderank.diagnostics;

import com.traderank.domain.model.MatchDiagnostic;
import com.traderank.event.EventPublisherHelper;
import org.springframework.stereotype.Component;

/**
 * Default sink: forwards each diagnostic as a
 * {@link com.traderank.event.MatchDiagnosticEvent} so that logging and metrics
 * listeners can observe it without the engine knowing about them.
 */
@Component
public class EventPublishingDiagnosticSink implements MatchDiagnosticSink {

    private final EventPublisherHelper eventPublisherHelper;

    public EventPublishingDiagnosticSink(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void report(MatchDiagnostic diagnostic) {
        eventPublisherHelper.publishMatchDiagnostic(this, diagnostic);
    }
}
