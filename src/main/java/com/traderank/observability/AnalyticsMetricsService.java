package com.traderank.observability;

import com.traderank.domain.enums.DiagnosticType;
import com.traderank.event.MatchDiagnosticEvent;
import com.traderank.event.TradingSummaryEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the analysis engine:
 * <ul>
 *   <li><b>traderank.diagnostics</b> (counter, tag {@code type}): matching anomalies by type</li>
 *   <li><b>traderank.analysis.runs</b> (counter): completed analysis runs</li>
 *   <li><b>traderank.analysis.trades</b> (counter): fills supplied to completed runs</li>
 *   <li><b>traderank.analysis.duration</b> (timer): wall time of each run</li>
 *   <li><b>traderank.analysis.last.pnl</b> (gauge): realized P&L of the latest run</li>
 * </ul>
 */
@Service
public class AnalyticsMetricsService {

    private final Map<DiagnosticType, Counter> diagnosticCounters = new EnumMap<>(DiagnosticType.class);
    private final Counter runCounter;
    private final Counter tradeCounter;
    private final Timer runTimer;
    private final AtomicReference<Double> lastRealizedPnl = new AtomicReference<>(0.0);

    public AnalyticsMetricsService(MeterRegistry meterRegistry) {
        for (DiagnosticType type : DiagnosticType.values()) {
            diagnosticCounters.put(type, Counter.builder("traderank.diagnostics")
                    .description("Non-fatal anomalies found while matching fills")
                    .tag("type", type.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }

        this.runCounter = Counter.builder("traderank.analysis.runs")
                .description("Completed analysis runs")
                .register(meterRegistry);

        this.tradeCounter = Counter.builder("traderank.analysis.trades")
                .description("Fills supplied to completed analysis runs")
                .register(meterRegistry);

        this.runTimer = Timer.builder("traderank.analysis.duration")
                .description("Wall time of an analysis run")
                .register(meterRegistry);

        meterRegistry.gauge("traderank.analysis.last.pnl", lastRealizedPnl, ref -> ref.get());
    }

    @EventListener
    public void onMatchDiagnostic(MatchDiagnosticEvent event) {
        diagnosticCounters.get(event.getDiagnostic().getType()).increment();
    }

    @EventListener
    public void onTradingSummary(TradingSummaryEvent event) {
        runCounter.increment();
        tradeCounter.increment(event.getInputTradeCount());
        runTimer.record(event.getDurationMs(), TimeUnit.MILLISECONDS);
        lastRealizedPnl.set(event.getSummary().getTotalPnl().doubleValue());
    }

    public double getDiagnosticCount(DiagnosticType type) {
        return diagnosticCounters.get(type).count();
    }

    public double getRunCount() {
        return runCounter.count();
    }
}
