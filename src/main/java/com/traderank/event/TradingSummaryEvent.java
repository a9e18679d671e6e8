package com.traderank.event;

import com.traderank.domain.model.TradingSummary;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published once at the end of every analysis run with the freshly computed summary.
 *
 * <p>Persistence and presentation collaborators subscribe to this event to store or
 * render the result. The summary is recomputed from scratch on every run, so listeners
 * should replace, not merge, whatever they hold.
 */
public class TradingSummaryEvent extends ApplicationEvent {

    private final TradingSummary summary;
    private final int inputTradeCount;
    private final long durationMs;
    private final LocalDateTime completedAt;

    public TradingSummaryEvent(Object source, TradingSummary summary, int inputTradeCount, long durationMs) {
        super(source);
        this.summary = summary;
        this.inputTradeCount = inputTradeCount;
        this.durationMs = durationMs;
        this.completedAt = LocalDateTime.now();
    }

    public TradingSummary getSummary() {
        return summary;
    }

    /** Number of fills supplied to the run. */
    public int getInputTradeCount() {
        return inputTradeCount;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }
}
