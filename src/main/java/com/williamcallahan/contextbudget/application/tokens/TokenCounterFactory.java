package com.williamcallahan.contextbudget.application.tokens;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Hands out one {@link TokenCounter} per model string.
 *
 * <p>Encoding resolution is a pure function of the model string, so counters are cached
 * and shared between concurrent trims.</p>
 */
@Component
public class TokenCounterFactory {

    private final TokenizerRegistry registry;
    private final ConcurrentMap<String, TokenCounter> countersByModel = new ConcurrentHashMap<>();

    public TokenCounterFactory(TokenizerRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Tokenizer registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * Returns the counter for a model, resolving it on first use.
     *
     * @param model model identifier; null is treated as the empty string
     * @return shared token counter for this model
     */
    public TokenCounter forModel(String model) {
        String key = model == null ? "" : model;
        return countersByModel.computeIfAbsent(key, modelKey -> new TokenCounter(modelKey, registry));
    }
}
