package com.williamcallahan.contextbudget.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one JSON line per trimmed request to the {@code INFERENCE} logger.
 */
@Component
public class TrimRequestLogger {

    private static final Logger log = LoggerFactory.getLogger(TrimRequestLogger.class);
    private static final Logger INFERENCE_LOG = LoggerFactory.getLogger("INFERENCE");

    private final ObjectMapper objectMapper;

    public TrimRequestLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Emits the record as a single JSON line.
     *
     * @param logRecord request summary to log
     */
    public void log(InferenceLogRecord logRecord) {
        try {
            INFERENCE_LOG.info(objectMapper.writeValueAsString(logRecord));
        } catch (JsonProcessingException serializationFailure) {
            log.warn("Failed to serialize inference log record for model {}: {}",
                    logRecord.model(), serializationFailure.getMessage());
        }
    }
}
