package com.williamcallahan.contextbudget.application.trim;

import java.util.List;

/**
 * Budget left for the conversation after retained system messages are paid for.
 *
 * @param keptSystemPositions positions, within the system message list, of retained system messages
 * @param systemTokens total cost of the retained system messages
 * @param remainingBudget tokens available for conversation messages, never negative
 */
public record BudgetAllocation(List<Integer> keptSystemPositions, int systemTokens, int remainingBudget) {

    public BudgetAllocation {
        keptSystemPositions = keptSystemPositions == null ? List.of() : List.copyOf(keptSystemPositions);
        if (remainingBudget < 0) {
            remainingBudget = 0;
        }
    }
}
