package com.williamcallahan.contextbudget.config;

import com.williamcallahan.contextbudget.service.DisabledSemanticRetentionScorer;
import com.williamcallahan.contextbudget.service.EmbeddingSemanticRetentionScorer;
import com.williamcallahan.contextbudget.service.SemanticRetentionScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the semantic retention scorer.
 *
 * <p>Scoring needs both {@code app.retention.enabled=true} and an {@link EmbeddingModel}
 * bean; otherwise trims report no retention score.</p>
 */
@Configuration
public class RetentionScorerConfig {

    private static final Logger log = LoggerFactory.getLogger(RetentionScorerConfig.class);

    @Bean
    public SemanticRetentionScorer semanticRetentionScorer(
            AppProperties appProperties, ObjectProvider<EmbeddingModel> embeddingModelProvider) {
        if (!appProperties.getRetention().isEnabled()) {
            log.info("Semantic retention scoring disabled (app.retention.enabled=false)");
            return new DisabledSemanticRetentionScorer();
        }
        EmbeddingModel embeddingModel = embeddingModelProvider.getIfAvailable();
        if (embeddingModel == null) {
            log.warn("Semantic retention scoring enabled but no EmbeddingModel bean is configured; disabling");
            return new DisabledSemanticRetentionScorer();
        }
        log.info("Semantic retention scoring enabled using {}", embeddingModel.getClass().getSimpleName());
        return new EmbeddingSemanticRetentionScorer(embeddingModel);
    }
}
