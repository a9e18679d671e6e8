package com.traderank.event;

import com.traderank.domain.model.MatchDiagnostic;
import com.traderank.domain.model.TradingSummary;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the TraderRank events.
 *
 * <p>Delivery is synchronous unless a listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Matching ----

    public void publishMatchDiagnostic(Object source, MatchDiagnostic diagnostic) {
        applicationEventPublisher.publishEvent(new MatchDiagnosticEvent(source, diagnostic));
    }

    // ---- Analysis ----

    public void publishTradingSummary(Object source, TradingSummary summary, int inputTradeCount, long durationMs) {
        applicationEventPublisher.publishEvent(new TradingSummaryEvent(source, summary, inputTradeCount, durationMs));
    }
}
