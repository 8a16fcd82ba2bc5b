package com.williamcallahan.contextbudget.service;

import com.williamcallahan.contextbudget.application.trim.ContextTrimmer;
import com.williamcallahan.contextbudget.config.AppProperties;
import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.domain.trim.TrimMetrics;
import com.williamcallahan.contextbudget.domain.trim.TrimResult;
import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Trims a chat history for the next model call and reports how the trim went.
 *
 * <p>Fills request defaults from {@code app.trim.*}, runs the trimming engine, attaches a
 * semantic retention score when a scorer is available, then publishes gauges and a
 * structured log record.</p>
 */
@Service
public class ContextTrimService {

    private static final Logger log = LoggerFactory.getLogger(ContextTrimService.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final ContextTrimmer contextTrimmer;
    private final SemanticRetentionScorer retentionScorer;
    private final TrimMetricsRecorder metricsRecorder;
    private final TrimRequestLogger requestLogger;
    private final AppProperties appProperties;

    public ContextTrimService(
            ContextTrimmer contextTrimmer,
            SemanticRetentionScorer retentionScorer,
            TrimMetricsRecorder metricsRecorder,
            TrimRequestLogger requestLogger,
            AppProperties appProperties) {
        this.contextTrimmer = contextTrimmer;
        this.retentionScorer = retentionScorer;
        this.metricsRecorder = metricsRecorder;
        this.requestLogger = requestLogger;
        this.appProperties = appProperties;
    }

    /**
     * Trims a conversation, using configured defaults for any omitted setting.
     *
     * @param messages conversation including system messages
     * @param targetTokens desired budget, or null for the configured default
     * @param model model identifier, or null/blank for the configured default
     * @param minTurns minimum turns to keep, or null for the configured default
     * @param priorityRoles roles that must never be dropped; may be null
     * @return retained messages with metrics, including retention when scored
     */
    public TrimResult trim(
            List<ChatMessage> messages,
            Integer targetTokens,
            String model,
            Integer minTurns,
            Collection<String> priorityRoles) {
        AppProperties.Trim defaults = appProperties.getTrim();
        int resolvedTarget = targetTokens != null ? targetTokens : defaults.getDefaultTargetTokens();
        String resolvedModel = model == null || model.isBlank() ? defaults.getDefaultModel() : model;
        int resolvedMinTurns = minTurns != null ? minTurns : defaults.getDefaultMinTurns();

        long startNanos = System.nanoTime();
        TrimResult trimmed =
                contextTrimmer.trim(messages, resolvedTarget, resolvedModel, resolvedMinTurns, priorityRoles);
        TrimResult scored = trimmed.withSemanticRetention(scoreRetention(messages, trimmed.messages()));
        double latencyMs = (System.nanoTime() - startNanos) / NANOS_PER_MILLI;

        TrimMetrics metrics = scored.metrics();
        metricsRecorder.observe(metrics);
        requestLogger.log(new InferenceLogRecord(
                resolvedModel,
                metrics.inputTokens(),
                metrics.outputTokens(),
                metrics.compressRatio(),
                metrics.semanticRetention(),
                latencyMs));
        return scored;
    }

    private Double scoreRetention(List<ChatMessage> before, List<ChatMessage> after) {
        try {
            OptionalDouble score = retentionScorer.score(before == null ? List.of() : before, after);
            return score.isPresent() ? score.getAsDouble() : null;
        } catch (RuntimeException scoringFailure) {
            log.warn("Semantic retention scoring failed (exception type: {})",
                    scoringFailure.getClass().getSimpleName(), scoringFailure);
            return null;
        }
    }
}
