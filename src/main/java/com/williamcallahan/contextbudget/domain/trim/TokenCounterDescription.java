package com.williamcallahan.contextbudget.domain.trim;

import java.util.Objects;

/**
 * Observability summary of the cost model used for a trim.
 *
 * @param mode "tiktoken" when an encoding was loaded, otherwise "heuristic"
 * @param encoding resolved encoding name, or null when none could be resolved
 */
public record TokenCounterDescription(String mode, String encoding) {

    public TokenCounterDescription {
        Objects.requireNonNull(mode, "Mode is required");
    }

    public static TokenCounterDescription of(TokenCountingMode mode, String encoding) {
        return new TokenCounterDescription(mode.label(), encoding);
    }
}
