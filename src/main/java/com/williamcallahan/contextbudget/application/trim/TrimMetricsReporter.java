package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.domain.trim.TokenCounterDescription;
import com.williamcallahan.contextbudget.domain.trim.TrimMetrics;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes compression statistics for a trim.
 */
public final class TrimMetricsReporter {

    private static final int RATIO_SCALE = 3;

    /**
     * Builds trim metrics from per-message costs.
     *
     * @param inputCosts cost of every input message, indexed by input position
     * @param keptPositions input positions of the retained messages
     * @param tokenCounter description of the cost model used
     * @return metrics with the semantic retention slot left unset
     */
    public TrimMetrics report(int[] inputCosts, Iterable<Integer> keptPositions, TokenCounterDescription tokenCounter) {
        int inputTokens = 0;
        for (int cost : inputCosts) {
            inputTokens += cost;
        }
        int outputTokens = 0;
        for (int position : keptPositions) {
            outputTokens += inputCosts[position];
        }
        return new TrimMetrics(inputTokens, outputTokens, compressRatio(outputTokens, inputTokens), tokenCounter, null);
    }

    /**
     * Rounds {@code outputTokens / max(1, inputTokens)} half-even to three decimals.
     *
     * <p>Rounding works on the exact binary value of the quotient, so 0.0005 stored as
     * 0.000499... rounds down.</p>
     *
     * @param outputTokens retained tokens
     * @param inputTokens original tokens
     * @return rounded ratio
     */
    static double compressRatio(int outputTokens, int inputTokens) {
        double ratio = (double) outputTokens / Math.max(1, inputTokens);
        return new BigDecimal(ratio).setScale(RATIO_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
