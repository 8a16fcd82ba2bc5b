package com.williamcallahan.contextbudget.service;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Rates how much meaning a trimmed conversation keeps relative to the original.
 */
public interface SemanticRetentionScorer {

    /**
     * Scores a trim.
     *
     * @param before conversation before trimming
     * @param after conversation after trimming
     * @return score in [0, 1], or empty when scoring is disabled, unavailable, or the inputs are degenerate
     */
    OptionalDouble score(List<ChatMessage> before, List<ChatMessage> after);
}
