package com.williamcallahan.contextbudget.domain.conversation;

import java.util.List;
import java.util.Set;

/**
 * A maximal contiguous run of conversation messages opened by a user message.
 *
 * <p>A conversation that starts with non-user messages has a leading turn with no user
 * message. Messages are addressed by position, so the same text appearing twice in a
 * conversation is still tracked as two distinct messages.</p>
 *
 * @param startIndex position of the first message of this turn within the conversation
 * @param messages the messages of this turn in conversation order
 */
public record ConversationTurn(int startIndex, List<ChatMessage> messages) {

    /**
     * Creates a turn with a defensive copy of its messages.
     *
     * @throws IllegalArgumentException if startIndex is negative or messages is null
     */
    public ConversationTurn {
        if (startIndex < 0) {
            throw new IllegalArgumentException("Start index cannot be negative");
        }
        if (messages == null) {
            throw new IllegalArgumentException("Messages cannot be null");
        }
        messages = List.copyOf(messages);
    }

    /**
     * Position one past the last message of this turn.
     *
     * @return exclusive end index within the conversation
     */
    public int endIndex() {
        return startIndex + messages.size();
    }

    /**
     * Checks whether any message in this turn carries a pinned role.
     *
     * @param priorityRoles roles that must never be dropped
     * @return true if at least one message has a priority role
     */
    public boolean hasPriorityRole(Set<String> priorityRoles) {
        if (priorityRoles.isEmpty()) {
            return false;
        }
        for (ChatMessage message : messages) {
            if (priorityRoles.contains(message.role())) {
                return true;
            }
        }
        return false;
    }
}
