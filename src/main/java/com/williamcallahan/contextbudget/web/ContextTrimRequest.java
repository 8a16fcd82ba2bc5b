package com.williamcallahan.contextbudget.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.util.ArrayList;
import java.util.List;

/**
 * Request body for {@code POST /api/context/trim}.
 *
 * @param messages conversation to trim, including system messages
 * @param targetTokens desired budget, or null for the configured default
 * @param model model identifier, or null for the configured default
 * @param minTurns minimum turns to keep, or null for the configured default
 * @param priorityRoles roles whose messages must never be dropped
 */
public record ContextTrimRequest(
        List<MessagePayload> messages,
        Integer targetTokens,
        String model,
        Integer minTurns,
        List<String> priorityRoles) {

    /**
     * Converts the wire messages into domain messages.
     *
     * @return domain messages in request order
     * @throws IllegalArgumentException if messages are missing or a message has no role
     */
    public List<ChatMessage> toChatMessages() {
        if (messages == null) {
            throw new IllegalArgumentException("Messages are required");
        }
        List<ChatMessage> converted = new ArrayList<>(messages.size());
        for (MessagePayload payload : messages) {
            if (payload == null) {
                throw new IllegalArgumentException("Messages cannot contain null entries");
            }
            converted.add(payload.toChatMessage());
        }
        return converted;
    }

    public List<String> priorityRolesOrEmpty() {
        return priorityRoles == null ? List.of() : priorityRoles;
    }

    /**
     * A chat message as received over the wire, with content of any JSON type.
     *
     * @param role participant role
     * @param content message content; non-string values are coerced to their text form
     */
    public record MessagePayload(String role, JsonNode content) {

        /**
         * Converts to a domain message, coercing non-string content to text.
         *
         * @return domain chat message
         */
        public ChatMessage toChatMessage() {
            return new ChatMessage(role, contentText());
        }

        private String contentText() {
            if (content == null || content.isNull() || content.isMissingNode()) {
                return "";
            }
            if (content.isValueNode()) {
                return content.asText();
            }
            return content.toString();
        }
    }
}
