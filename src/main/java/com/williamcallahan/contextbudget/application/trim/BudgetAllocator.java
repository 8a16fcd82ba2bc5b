package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.application.tokens.TokenCounter;
import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reserves budget for retained system messages.
 *
 * <p>The first system message is always retained. A later system message is retained only
 * when its role is itself a priority role, which in practice means the caller pinned
 * {@code "system"}.</p>
 */
public final class BudgetAllocator {

    /** Minimum usable budget applied to any caller-supplied target. */
    public static final int DEFAULT_FLOOR_TOKENS = 256;

    private final int floorTokens;

    public BudgetAllocator() {
        this(DEFAULT_FLOOR_TOKENS);
    }

    /**
     * Creates an allocator with a custom floor.
     *
     * @param floorTokens minimum budget; must be positive
     * @throws IllegalArgumentException if floorTokens is not positive
     */
    public BudgetAllocator(int floorTokens) {
        if (floorTokens <= 0) {
            throw new IllegalArgumentException("Floor tokens must be positive, got " + floorTokens);
        }
        this.floorTokens = floorTokens;
    }

    /**
     * Chooses which system messages to keep and computes the conversation budget.
     *
     * @param targetTokens caller-supplied target; raised to the floor when smaller
     * @param systemMessages system messages in input order
     * @param priorityRoles roles that must never be dropped
     * @param counter token cost model
     * @return retained system positions and the remaining budget
     */
    public BudgetAllocation allocate(
            int targetTokens, List<ChatMessage> systemMessages, Set<String> priorityRoles, TokenCounter counter) {
        int baseBudget = Math.max(floorTokens, targetTokens);
        List<Integer> kept = new ArrayList<>();
        int systemTokens = 0;
        for (int position = 0; position < systemMessages.size(); position++) {
            ChatMessage message = systemMessages.get(position);
            if (kept.isEmpty() || priorityRoles.contains(message.role())) {
                kept.add(position);
                systemTokens += counter.count(message.content());
            }
        }
        return new BudgetAllocation(kept, systemTokens, Math.max(0, baseBudget - systemTokens));
    }

    public int floorTokens() {
        return floorTokens;
    }
}
