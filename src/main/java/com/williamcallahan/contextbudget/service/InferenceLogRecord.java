package com.williamcallahan.contextbudget.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One structured log line describing a trimmed chat request.
 *
 * @param model model identifier the trim was costed for
 * @param tokenIn tokens before trimming
 * @param tokenOut tokens after trimming
 * @param compressRatio output over input tokens
 * @param semanticRetention retention score, or null when not scored
 * @param latencyMs wall-clock time spent trimming and scoring
 */
public record InferenceLogRecord(
        @JsonProperty("model") String model,
        @JsonProperty("token_in") int tokenIn,
        @JsonProperty("token_out") int tokenOut,
        @JsonProperty("compress_ratio") double compressRatio,
        @JsonProperty("semantic_retention") Double semanticRetention,
        @JsonProperty("latency_ms") double latencyMs) {
}
