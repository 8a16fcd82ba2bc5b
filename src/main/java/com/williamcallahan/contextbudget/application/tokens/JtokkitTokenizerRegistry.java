package com.williamcallahan.contextbudget.application.tokens;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.GptBytePairEncodingParams;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer registry backed by a JTokkit {@link EncodingRegistry} owned by this instance.
 *
 * <p>Each instance holds its own registry so fallback registrations never leak across
 * registries. Lookups are safe for concurrent use; fallback registration is serialized.</p>
 */
public class JtokkitTokenizerRegistry implements TokenizerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JtokkitTokenizerRegistry.class);

    /** Terminal special token appended after the 256 byte tokens. */
    static final String END_OF_TEXT = "<|endoftext|>";

    private static final int BYTE_VALUES = 256;

    private static final Pattern SINGLE_CHARACTER = Pattern.compile("(?s).");

    private final EncodingRegistry registry;

    public JtokkitTokenizerRegistry() {
        this(Encodings.newDefaultEncodingRegistry());
    }

    /**
     * Creates a registry view over an existing JTokkit registry.
     *
     * @param registry JTokkit registry to resolve and register encodings in
     */
    public JtokkitTokenizerRegistry(EncodingRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Encoding registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public Optional<Encoding> resolve(String encodingName) {
        if (encodingName == null || encodingName.isBlank()) {
            return Optional.empty();
        }
        try {
            return registry.getEncoding(encodingName);
        } catch (RuntimeException loadFailure) {
            log.warn("Failed to load encoding {}: {}", encodingName, loadFailure.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> encodingNameForModel(String model) {
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        try {
            return registry.getEncodingForModel(model).map(Encoding::getName);
        } catch (RuntimeException lookupFailure) {
            log.debug("No encoding registered for model {}: {}", model, lookupFailure.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized Optional<Encoding> registerByteLevelFallback(String encodingName) {
        if (encodingName == null || encodingName.isBlank()) {
            return Optional.empty();
        }
        Optional<Encoding> existing = resolve(encodingName);
        if (existing.isPresent()) {
            return existing;
        }
        try {
            registry.registerGptBytePairEncoding(byteLevelParams(encodingName));
            log.info("Registered byte-level fallback encoding {}", encodingName);
            return registry.getEncoding(encodingName);
        } catch (RuntimeException registrationFailure) {
            log.warn("Failed to register byte-level fallback {}: {}",
                    encodingName, registrationFailure.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builds parameters for an encoding with one token per byte and a single special token.
     *
     * @param encodingName name of the encoding to build
     * @return JTokkit parameters for the byte-level encoding
     */
    static GptBytePairEncodingParams byteLevelParams(String encodingName) {
        Map<byte[], Integer> mergeableRanks = new HashMap<>();
        for (int byteValue = 0; byteValue < BYTE_VALUES; byteValue++) {
            mergeableRanks.put(new byte[] {(byte) byteValue}, byteValue);
        }
        Map<String, Integer> specialTokens = Map.of(END_OF_TEXT, BYTE_VALUES);
        return new GptBytePairEncodingParams(encodingName, SINGLE_CHARACTER, mergeableRanks, specialTokens);
    }
}
