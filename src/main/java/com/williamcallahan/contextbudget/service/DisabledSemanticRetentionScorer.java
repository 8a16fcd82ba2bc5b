package com.williamcallahan.contextbudget.service;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Scorer used when semantic retention is switched off; never produces a score.
 */
public final class DisabledSemanticRetentionScorer implements SemanticRetentionScorer {

    @Override
    public OptionalDouble score(List<ChatMessage> before, List<ChatMessage> after) {
        return OptionalDouble.empty();
    }
}
