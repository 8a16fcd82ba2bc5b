package com.williamcallahan.contextbudget.web;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.service.ContextTrimService;
import com.williamcallahan.contextbudget.service.TrimMetricsRecorder;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes context trimming to the chat orchestration loop.
 */
@RestController
@RequestMapping("/api/context")
public class ContextTrimController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(ContextTrimController.class);

    private final ContextTrimService contextTrimService;
    private final TrimMetricsRecorder metricsRecorder;

    public ContextTrimController(
            ContextTrimService contextTrimService,
            TrimMetricsRecorder metricsRecorder,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.contextTrimService = contextTrimService;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Trims a conversation to fit a token budget.
     *
     * @param request conversation and trim settings
     * @return the trim result, or an error payload for malformed requests
     */
    @PostMapping(value = "/trim", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> trim(@RequestBody ContextTrimRequest request) {
        List<ChatMessage> messages;
        try {
            messages = request.toChatMessages();
        } catch (IllegalArgumentException validationException) {
            log.debug("Rejected trim request: {}", validationException.getMessage());
            return handleValidationException(validationException);
        }
        try {
            return ResponseEntity.ok(contextTrimService.trim(
                    messages,
                    request.targetTokens(),
                    request.model(),
                    request.minTurns(),
                    request.priorityRolesOrEmpty()));
        } catch (RuntimeException trimFailure) {
            log.error("Context trim failed for {} messages", messages.size(), trimFailure);
            return handleServiceException(trimFailure, "trim context");
        }
    }

    /**
     * Returns the latest compression ratio and semantic retention gauges.
     *
     * @return gauge name to value; retention is null when unset
     */
    @GetMapping(value = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Double> metrics() {
        return metricsRecorder.snapshot();
    }
}
