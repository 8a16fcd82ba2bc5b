package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.domain.conversation.ConversationTurn;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a conversation into turns.
 *
 * <p>A user message always opens a new turn; every other message joins the open turn.
 * Messages before the first user message form a leading turn of their own. Concatenating
 * the returned turns reproduces the input exactly.</p>
 */
public final class TurnGrouper {

    /**
     * Groups conversation messages into turns in a single pass.
     *
     * @param conversation ordered conversation messages (system messages already removed)
     * @return turns in conversation order; empty for an empty conversation
     */
    public List<ConversationTurn> group(List<ChatMessage> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return List.of();
        }
        List<ConversationTurn> turns = new ArrayList<>();
        List<ChatMessage> current = new ArrayList<>();
        int currentStart = 0;
        for (int position = 0; position < conversation.size(); position++) {
            ChatMessage message = conversation.get(position);
            if (message.hasRole(ChatMessage.ROLE_USER) && !current.isEmpty()) {
                turns.add(new ConversationTurn(currentStart, current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                currentStart = position;
            }
            current.add(message);
        }
        turns.add(new ConversationTurn(currentStart, current));
        return List.copyOf(turns);
    }
}
