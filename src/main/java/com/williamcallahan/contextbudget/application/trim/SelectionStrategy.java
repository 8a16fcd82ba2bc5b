package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.domain.conversation.ConversationTurn;
import java.util.List;
import java.util.Set;

/**
 * Decides which conversation messages survive a budget.
 *
 * <p>Every strategy keeps the whole latest turn and every priority-role message regardless
 * of budget. Such forced content is charged against the budget but never stops the scan,
 * and an oversized optional message never prevents older content from being considered.</p>
 */
public interface SelectionStrategy {

    /**
     * Selects the conversation messages to retain.
     *
     * @param turns conversation turns in order, covering every conversation position
     * @param costs token cost of each conversation message, indexed by conversation position
     * @param budget tokens available for conversation messages
     * @param priorityRoles roles that must never be dropped
     * @return retained conversation positions in ascending order
     */
    List<Integer> select(List<ConversationTurn> turns, int[] costs, int budget, Set<String> priorityRoles);
}
