package com.williamcallahan.contextbudget.application.tokens;

import com.knuddels.jtokkit.api.Encoding;
import com.williamcallahan.contextbudget.domain.trim.TokenCounterDescription;
import com.williamcallahan.contextbudget.domain.trim.TokenCountingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the token cost of text for one model family.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>Longest matching model prefix from {@link #MODEL_PREFIX_ENCODINGS}</li>
 *   <li>The registry's own model table, keyed by the exact model string</li>
 * </ol>
 * A resolved name that fails to load is replaced by a byte-level fallback registered under
 * the same name. When no name resolves at all, counting falls back to {@code max(1, length / 4)}.</p>
 *
 * <p>No exception escapes this class; failures lower precision, never availability.
 * Instances are immutable and safe to share across threads.</p>
 */
public final class TokenCounter {

    private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);

    /** Characters per token assumed by the heuristic estimate. */
    private static final int HEURISTIC_CHARS_PER_TOKEN = 4;

    /** Model prefixes mapped to encoding names, longest prefix first. */
    static final List<Map.Entry<String, String>> MODEL_PREFIX_ENCODINGS = List.of(
            Map.entry("gpt-3.5", "cl100k_base"),
            Map.entry("gpt-4o", "o200k_base"),
            Map.entry("gpt-5", "o200k_base"),
            Map.entry("gpt-4", "cl100k_base"));

    private final String model;
    private final String encodingName;
    private final Encoding encoding;

    /**
     * Resolves the cost model for a model identifier.
     *
     * @param model model identifier; null is treated as unknown
     * @param registry tokenizer registry to resolve encodings from
     */
    public TokenCounter(String model, TokenizerRegistry registry) {
        this.model = model == null ? "" : model;
        this.encodingName = resolveEncodingName(this.model, registry);
        this.encoding = loadEncoding(encodingName, registry);
    }

    private static String resolveEncodingName(String model, TokenizerRegistry registry) {
        String normalized = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> prefixEncoding : MODEL_PREFIX_ENCODINGS) {
            if (normalized.startsWith(prefixEncoding.getKey())) {
                return prefixEncoding.getValue();
            }
        }
        try {
            return registry.encodingNameForModel(model).orElse(null);
        } catch (RuntimeException lookupFailure) {
            log.debug("Encoding lookup failed for model {}: {}", model, lookupFailure.getMessage());
            return null;
        }
    }

    private static Encoding loadEncoding(String encodingName, TokenizerRegistry registry) {
        if (encodingName == null) {
            return null;
        }
        try {
            Optional<Encoding> loaded = registry.resolve(encodingName);
            if (loaded.isPresent()) {
                return loaded.get();
            }
            log.warn("Encoding {} unavailable, registering byte-level fallback", encodingName);
            return registry.registerByteLevelFallback(encodingName).orElse(null);
        } catch (RuntimeException loadFailure) {
            log.warn("Encoding {} could not be loaded: {}", encodingName, loadFailure.getMessage());
            return null;
        }
    }

    /**
     * Counts the tokens of a text. Special-token markers are counted as ordinary text.
     *
     * @param text text to cost; null counts as empty
     * @return token count, at least 1 in heuristic mode
     */
    public int count(String text) {
        String safeText = text == null ? "" : text;
        if (encoding != null) {
            try {
                return encoding.countTokensOrdinary(safeText);
            } catch (RuntimeException encodeFailure) {
                log.debug("Encoding {} failed, estimating heuristically: {}",
                        encodingName, encodeFailure.getMessage());
            }
        }
        return heuristicCount(safeText);
    }

    static int heuristicCount(String text) {
        return Math.max(1, text.codePointCount(0, text.length()) / HEURISTIC_CHARS_PER_TOKEN);
    }

    /**
     * Describes the cost model for observability.
     *
     * @return counting mode and encoding name, when known
     */
    public TokenCounterDescription describe() {
        TokenCountingMode mode = encoding != null ? TokenCountingMode.TIKTOKEN : TokenCountingMode.HEURISTIC;
        return TokenCounterDescription.of(mode, encodingName);
    }

    public String model() {
        return model;
    }
}
