package com.traderank.unit.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.traderank.analytics.WeeklySummaryAggregator;
import com.traderank.domain.model.DailySummary;
import com.traderank.domain.model.WeeklySummary;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WeeklySummaryAggregator covering ISO week grouping, weighted averages,
 * best/worst day selection and the week window boundaries.
 */
class WeeklySummaryAggregatorTest {

    private WeeklySummaryAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new WeeklySummaryAggregator();
    }

    private static DailySummary day(String date, int wins, String avgWin, int losses, String avgLoss, String pnl) {
        BigDecimal realized = new BigDecimal(pnl);
        return DailySummary.builder()
                .date(LocalDate.parse(date))
                .totalTrades(wins + losses)
                .winningTrades(wins)
                .losingTrades(losses)
                .realizedPnl(realized)
                .grossPnl(realized.add(BigDecimal.ONE))
                .totalCommission(BigDecimal.ONE)
                .totalVolume(new BigDecimal("1000"))
                .avgWin(new BigDecimal(avgWin))
                .avgLoss(new BigDecimal(avgLoss))
                .largestWin(new BigDecimal(avgWin))
                .largestLoss(new BigDecimal(avgLoss))
                .build();
    }

    // ==============================
    // AVERAGES AND TOTALS
    // ==============================

    @Nested
    @DisplayName("Averages and totals")
    class AveragesAndTotals {

        @Test
        @DisplayName("Average win is weighted by winning trade counts, not a mean of daily averages")
        void weightedAverageWin() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(
                    day("2025-03-10", 2, "10", 0, "0", "20"),
                    day("2025-03-11", 3, "20", 0, "0", "60")));

            // (2 * 10 + 3 * 20) / 5
            assertThat(week.getAvgWin()).isEqualByComparingTo("16");
            assertThat(week.getWinningTrades()).isEqualTo(5);
            assertThat(week.getAvgLoss()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Counts, P&L, commission and volume are sums over the days")
        void totalsAreSums() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(
                    day("2025-03-10", 1, "30", 1, "-10", "19"),
                    day("2025-03-12", 0, "0", 2, "-15", "-31")));

            assertThat(week.getTotalTrades()).isEqualTo(4);
            assertThat(week.getWinningTrades()).isEqualTo(1);
            assertThat(week.getLosingTrades()).isEqualTo(3);
            assertThat(week.getRealizedPnl()).isEqualByComparingTo("-12");
            assertThat(week.getTotalCommission()).isEqualByComparingTo("2");
            assertThat(week.getGrossPnl().subtract(week.getRealizedPnl()))
                    .isEqualByComparingTo(week.getTotalCommission());
            assertThat(week.getTotalVolume()).isEqualByComparingTo("2000");
            assertThat(week.getWinRate()).isCloseTo(25.0, within(1e-9));
            // (1 * -10 + 2 * -15) / 3
            assertThat(week.getAvgLoss()).isEqualByComparingTo(
                    new BigDecimal("-40").divide(new BigDecimal("3"), MathContext.DECIMAL128));
            assertThat(week.getLargestWin()).isEqualByComparingTo("30");
            assertThat(week.getLargestLoss()).isEqualByComparingTo("-15");
            assertThat(week.getTradingDays()).isEqualTo(2);
            assertThat(week.getProfitableDays()).isEqualTo(1);
            assertThat(week.getAvgDailyPnl()).isEqualByComparingTo("-6");
        }

        @Test
        @DisplayName("Traded symbols are the sorted union across days")
        void symbolUnion() {
            DailySummary monday = day("2025-03-10", 1, "10", 0, "0", "10");
            monday.setSymbolsTraded(List.of("MSFT", "AAPL"));
            DailySummary tuesday = day("2025-03-11", 1, "10", 0, "0", "10");
            tuesday.setSymbolsTraded(List.of("AAPL", "TSLA"));

            WeeklySummary week = aggregator.fold(2025, 11, List.of(tuesday, monday));

            assertThat(week.getSymbolsTraded()).containsExactly("AAPL", "MSFT", "TSLA");
            assertThat(week.getDailySummaries()).extracting(DailySummary::getDate)
                    .containsExactly(LocalDate.parse("2025-03-10"), LocalDate.parse("2025-03-11"));
        }
    }

    // ==============================
    // BEST AND WORST DAY
    // ==============================

    @Nested
    @DisplayName("Best and worst day")
    class BestAndWorstDay {

        @Test
        @DisplayName("Picks the highest and lowest realized P&L")
        void picksExtremes() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(
                    day("2025-03-10", 1, "10", 0, "0", "10"),
                    day("2025-03-11", 0, "0", 1, "-40", "-40"),
                    day("2025-03-12", 1, "90", 0, "0", "90")));

            assertThat(week.getBestDay().getDate()).isEqualTo(LocalDate.parse("2025-03-12"));
            assertThat(week.getBestDay().getPnl()).isEqualByComparingTo("90");
            assertThat(week.getWorstDay().getDate()).isEqualTo(LocalDate.parse("2025-03-11"));
            assertThat(week.getWorstDay().getPnl()).isEqualByComparingTo("-40");
        }

        @Test
        @DisplayName("Ties resolve to the earliest day regardless of input order")
        void tiesResolveToEarliestDay() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(
                    day("2025-03-13", 1, "50", 0, "0", "50"),
                    day("2025-03-10", 1, "50", 0, "0", "50")));

            assertThat(week.getBestDay().getDate()).isEqualTo(LocalDate.parse("2025-03-10"));
            assertThat(week.getWorstDay().getDate()).isEqualTo(LocalDate.parse("2025-03-10"));
        }

        @Test
        @DisplayName("Break-even day is not profitable")
        void breakEvenDayNotProfitable() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(day("2025-03-10", 0, "0", 0, "0", "0")));

            assertThat(week.getProfitableDays()).isZero();
            assertThat(week.getTradingDays()).isEqualTo(1);
        }
    }

    // ==============================
    // ISO WEEKS
    // ==============================

    @Nested
    @DisplayName("ISO week grouping")
    class IsoWeeks {

        @Test
        @DisplayName("Days are grouped by ISO week and weeks are returned ascending")
        void groupsAndSortsWeeks() {
            List<WeeklySummary> weeks = aggregator.aggregate(List.of(
                    day("2025-03-17", 1, "10", 0, "0", "10"),
                    day("2025-03-10", 1, "10", 0, "0", "10"),
                    day("2025-03-16", 1, "10", 0, "0", "10")));

            assertThat(weeks).extracting(WeeklySummary::getWeekNumber).containsExactly(11, 12);
            assertThat(weeks.get(0).getTradingDays()).isEqualTo(2);
            assertThat(weeks.get(1).getTradingDays()).isEqualTo(1);
        }

        @Test
        @DisplayName("Week window runs from Monday 00:00:00 to Sunday 23:59:59 UTC")
        void weekWindow() {
            WeeklySummary week = aggregator.fold(2025, 11, List.of(day("2025-03-12", 1, "10", 0, "0", "10")));

            assertThat(week.getStartDate()).isEqualTo(Instant.parse("2025-03-10T00:00:00Z"));
            assertThat(week.getEndDate()).isEqualTo(Instant.parse("2025-03-16T23:59:59Z"));
        }

        @Test
        @DisplayName("Late December day can belong to week 1 of the next ISO year")
        void isoYearBoundary() {
            List<WeeklySummary> weeks = aggregator.aggregate(List.of(
                    day("2024-12-30", 1, "10", 0, "0", "10"),
                    day("2025-01-02", 1, "10", 0, "0", "10")));

            assertThat(weeks).singleElement().satisfies(week -> {
                assertThat(week.getIsoYear()).isEqualTo(2025);
                assertThat(week.getWeekNumber()).isEqualTo(1);
                assertThat(week.getStartDate()).isEqualTo(Instant.parse("2024-12-30T00:00:00Z"));
                assertThat(week.getTradingDays()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("Aggregating and folding the same days give the same week")
        void aggregateMatchesFold() {
            List<DailySummary> days = List.of(
                    day("2025-03-10", 2, "10", 1, "-5", "15"),
                    day("2025-03-14", 3, "20", 0, "0", "60"));

            WeeklySummary aggregated = aggregator.aggregate(days).get(0);
            WeeklySummary folded = aggregator.fold(2025, 11, days);

            assertThat(aggregated).isEqualTo(folded);
        }

        @Test
        @DisplayName("No days yields no weeks")
        void empty() {
            assertThat(aggregator.aggregate(List.of())).isEmpty();
        }
    }
}
