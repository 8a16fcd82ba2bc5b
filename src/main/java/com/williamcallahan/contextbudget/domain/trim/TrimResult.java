package com.williamcallahan.contextbudget.domain.trim;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of fitting a conversation into a token budget.
 *
 * @param messages retained messages, an order-preserving subsequence of the input
 * @param metrics compression statistics for this trim
 */
public record TrimResult(List<ChatMessage> messages, TrimMetrics metrics) {

    public TrimResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
        Objects.requireNonNull(metrics, "Metrics are required");
    }

    /**
     * Returns a copy with the semantic retention slot populated.
     *
     * @param score retention score, or null when unavailable
     * @return result with updated metrics
     */
    public TrimResult withSemanticRetention(Double score) {
        return new TrimResult(messages, metrics.withSemanticRetention(score));
    }
}
