package com.traderank.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

final class ProfitFactors {

    private ProfitFactors() {}

    /**
     * Total won / total lost, reconstructed from averages and counts.
     * Empty when nothing was lost.
     */
    static Optional<BigDecimal> of(BigDecimal avgWin, int winningTrades, BigDecimal avgLoss, int losingTrades) {
        if (losingTrades == 0 || avgLoss == null || avgLoss.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal totalWins = avgWin.multiply(BigDecimal.valueOf(winningTrades));
        BigDecimal totalLosses = avgLoss.abs().multiply(BigDecimal.valueOf(losingTrades));
        if (totalLosses.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(totalWins.divide(totalLosses, MathContext.DECIMAL128));
    }
}
