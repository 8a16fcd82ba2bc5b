package com.williamcallahan.contextbudget.application.tokens;

import com.knuddels.jtokkit.api.Encoding;
import java.util.Optional;

/**
 * Source of BPE encodings for token counting.
 *
 * <p>Implementations signal every failure (unknown name, missing assets, corrupted
 * data) with an empty result instead of throwing, so callers can fall back.</p>
 */
public interface TokenizerRegistry {

    /**
     * Loads an encoding by name.
     *
     * @param encodingName encoding profile name, such as "cl100k_base"
     * @return the encoding, or empty when it cannot be loaded
     */
    Optional<Encoding> resolve(String encodingName);

    /**
     * Looks up the encoding name the registry associates with an exact model string.
     *
     * @param model model identifier as supplied by the caller
     * @return encoding name, or empty when the model is unknown
     */
    Optional<String> encodingNameForModel(String model);

    /**
     * Registers (or returns the already registered) byte-level encoding under the given name.
     *
     * <p>The byte-level encoding maps each byte value 0-255 to its own token and adds one
     * terminal special token, so it needs no external assets.</p>
     *
     * @param encodingName name to register the fallback under
     * @return the fallback encoding, or empty if registration failed
     */
    Optional<Encoding> registerByteLevelFallback(String encodingName);
}
