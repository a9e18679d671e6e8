package com.traderank.integration;

import static com.traderank.unit.TradeFixtures.buy;
import static com.traderank.unit.TradeFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;

import com.traderank.analytics.TradingAnalyticsService;
import com.traderank.analytics.TradingPeriodAnalyzer;
import com.traderank.config.TradingPeriodConfig;
import com.traderank.diagnostics.EventPublishingDiagnosticSink;
import com.traderank.diagnostics.MatchDiagnosticSink;
import com.traderank.domain.enums.DiagnosticType;
import com.traderank.domain.model.TradeRecord;
import com.traderank.domain.model.TradingPeriod;
import com.traderank.domain.model.TradingSummary;
import com.traderank.observability.AnalyticsMetricsService;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Boots the application context and runs the engine end to end: configuration binding,
 * the event-publishing diagnostic sink and the metrics listeners.
 */
@SpringBootTest
class TraderRankApplicationContextTest {

    @Autowired
    private TradingAnalyticsService tradingAnalyticsService;

    @Autowired
    private TradingPeriodAnalyzer tradingPeriodAnalyzer;

    @Autowired
    private TradingPeriodConfig tradingPeriodConfig;

    @Autowired
    private MatchDiagnosticSink matchDiagnosticSink;

    @Autowired
    private AnalyticsMetricsService analyticsMetricsService;

    @Test
    @DisplayName("Period table and top count are bound from application.yml")
    void periodTableBound() {
        assertThat(tradingPeriodConfig.getTopCount()).isEqualTo(3);
        assertThat(tradingPeriodConfig.getWindows())
                .extracting(TradingPeriodConfig.Window::getName)
                .containsExactly(
                        "Pre-Market", "Market Open", "Morning", "Lunch", "Afternoon", "Power Hour", "After-Hours");
        assertThat(matchDiagnosticSink).isInstanceOf(EventPublishingDiagnosticSink.class);
    }

    @Test
    @DisplayName("Analysis run publishes diagnostics and completion to the metrics listener")
    void analysisRunObserved() {
        double unmatchedBefore = analyticsMetricsService.getDiagnosticCount(DiagnosticType.UNMATCHED);
        double runsBefore = analyticsMetricsService.getRunCount();

        List<TradeRecord> trades = List.of(
                buy("AAPL", "100", "10", "2025-03-10T09:30:00", "1"),
                sell("AAPL", "100", "12", "2025-03-10T10:00:00", "1"),
                buy("MSFT", "5", "300", "2025-03-11T15:00:00"));

        TradingSummary summary = tradingAnalyticsService.analyzeTrades(trades);

        assertThat(summary.getDailySummaries()).hasSize(2);
        assertThat(summary.getTotalPnl()).isEqualByComparingTo("198");
        assertThat(analyticsMetricsService.getDiagnosticCount(DiagnosticType.UNMATCHED))
                .isEqualTo(unmatchedBefore + 1);
        assertThat(analyticsMetricsService.getRunCount()).isEqualTo(runsBefore + 1);
    }

    @Test
    @DisplayName("Top periods use the configured count")
    void topPeriodsConfigured() {
        List<TradingPeriod> top = tradingPeriodAnalyzer.topPeriods(List.of(
                sell("AAPL", "1", "50", "2025-03-10T10:30:00")));

        assertThat(top).hasSize(3);
        assertThat(top.get(0).getName()).isEqualTo("Morning");
    }
}
