package com.williamcallahan.contextbudget.domain.trim;

import java.util.Objects;

/**
 * Compression statistics for one trim.
 *
 * <p>{@code semanticRetention} is a reserved slot: the trimming engine always leaves it
 * null and only an external scorer fills it through {@link #withSemanticRetention(Double)}.</p>
 *
 * @param inputTokens total cost of every input message
 * @param outputTokens total cost of the retained messages
 * @param compressRatio output over input tokens, rounded to three decimals
 * @param tokenCounter description of the cost model
 * @param semanticRetention similarity between the original and trimmed conversation, or null
 */
public record TrimMetrics(
        int inputTokens,
        int outputTokens,
        double compressRatio,
        TokenCounterDescription tokenCounter,
        Double semanticRetention) {

    public TrimMetrics {
        Objects.requireNonNull(tokenCounter, "Token counter description is required");
    }

    /**
     * Returns a copy carrying the given semantic retention score.
     *
     * @param score retention score in [0, 1], or null when unavailable
     * @return metrics with the retention slot populated
     */
    public TrimMetrics withSemanticRetention(Double score) {
        return new TrimMetrics(inputTokens, outputTokens, compressRatio, tokenCounter, score);
    }
}
