package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.domain.conversation.ConversationTurn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Fills the budget message by message, newest first.
 *
 * <p>Forced messages (the latest turn and priority-role messages) are always kept. Any
 * other message is kept only if it still fits; one that does not fit is skipped and the
 * scan continues with older messages.</p>
 */
public final class MessagePreservingSelector implements SelectionStrategy {

    @Override
    public List<Integer> select(List<ConversationTurn> turns, int[] costs, int budget, Set<String> priorityRoles) {
        if (turns.isEmpty()) {
            return List.of();
        }
        boolean[] forced = markForced(turns, costs.length, priorityRoles);

        List<Integer> kept = new ArrayList<>();
        int keptTotal = 0;
        for (int position = costs.length - 1; position >= 0; position--) {
            int cost = costs[position];
            if (forced[position] || keptTotal + cost <= budget) {
                kept.add(position);
                keptTotal += cost;
            }
        }
        Collections.reverse(kept);
        return List.copyOf(kept);
    }

    private static boolean[] markForced(List<ConversationTurn> turns, int size, Set<String> priorityRoles) {
        boolean[] forced = new boolean[size];
        ConversationTurn latest = turns.get(turns.size() - 1);
        for (int position = latest.startIndex(); position < latest.endIndex(); position++) {
            forced[position] = true;
        }
        if (!priorityRoles.isEmpty()) {
            for (ConversationTurn turn : turns) {
                List<ChatMessage> messages = turn.messages();
                for (int offset = 0; offset < messages.size(); offset++) {
                    if (priorityRoles.contains(messages.get(offset).role())) {
                        forced[turn.startIndex() + offset] = true;
                    }
                }
            }
        }
        return forced;
    }
}
