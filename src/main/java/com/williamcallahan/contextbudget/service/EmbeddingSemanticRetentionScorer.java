package com.williamcallahan.contextbudget.service;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Scores retention as the cosine similarity between embeddings of the full and trimmed conversation.
 *
 * <p>Each side is flattened by joining its non-empty message contents with newlines. Embedding
 * failures are logged and reported as "no score" so a trim never fails because of scoring.</p>
 */
public class EmbeddingSemanticRetentionScorer implements SemanticRetentionScorer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSemanticRetentionScorer.class);

    private static final int SCORE_SCALE = 3;

    private final EmbeddingModel embeddingModel;

    public EmbeddingSemanticRetentionScorer(EmbeddingModel embeddingModel) {
        if (embeddingModel == null) {
            throw new IllegalArgumentException("Embedding model cannot be null");
        }
        this.embeddingModel = embeddingModel;
    }

    @Override
    public OptionalDouble score(List<ChatMessage> before, List<ChatMessage> after) {
        String beforeText = aggregate(before);
        String afterText = aggregate(after);
        if (beforeText.isEmpty() || afterText.isEmpty()) {
            return OptionalDouble.empty();
        }
        float[] beforeVector;
        float[] afterVector;
        try {
            beforeVector = embeddingModel.embed(beforeText);
            afterVector = embeddingModel.embed(afterText);
        } catch (RuntimeException embeddingFailure) {
            log.warn("Semantic retention embedding failed (exception type: {}): {}",
                    embeddingFailure.getClass().getSimpleName(), embeddingFailure.getMessage());
            return OptionalDouble.empty();
        }
        return cosineSimilarity(beforeVector, afterVector);
    }

    static String aggregate(List<ChatMessage> messages) {
        if (messages == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : messages) {
            if (message.content().isEmpty()) {
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(message.content());
        }
        return text.toString();
    }

    static OptionalDouble cosineSimilarity(float[] left, float[] right) {
        if (left == null || right == null || left.length == 0 || right.length == 0) {
            return OptionalDouble.empty();
        }
        int dimensions = Math.min(left.length, right.length);
        double dot = 0.0;
        for (int i = 0; i < dimensions; i++) {
            dot += (double) left[i] * right[i];
        }
        double denominator = norm(left) * norm(right);
        if (denominator == 0.0) {
            return OptionalDouble.empty();
        }
        double similarity = dot / denominator;
        return OptionalDouble.of(
                new BigDecimal(similarity).setScale(SCORE_SCALE, RoundingMode.HALF_EVEN).doubleValue());
    }

    private static double norm(float[] vector) {
        double sumOfSquares = 0.0;
        for (float component : vector) {
            sumOfSquares += (double) component * component;
        }
        return Math.sqrt(sumOfSquares);
    }
}
