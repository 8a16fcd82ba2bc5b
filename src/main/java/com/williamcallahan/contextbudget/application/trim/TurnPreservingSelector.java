package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.domain.conversation.ConversationTurn;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fills the budget turn by turn, newest first, guaranteeing a minimum number of turns.
 *
 * <p>The latest turn is always kept and counts toward both the running total and the
 * number of kept turns. An older turn is kept when it fits, when fewer than
 * {@code minTurns} turns have been kept, or when it contains a priority-role message.
 * Turns that qualify on none of these are skipped without ending the scan.</p>
 */
public final class TurnPreservingSelector implements SelectionStrategy {

    private final int minTurns;

    /**
     * @param minTurns minimum number of turns to keep, including the latest; must be positive
     * @throws IllegalArgumentException if minTurns is not positive
     */
    public TurnPreservingSelector(int minTurns) {
        if (minTurns <= 0) {
            throw new IllegalArgumentException("Minimum turns must be positive, got " + minTurns);
        }
        this.minTurns = minTurns;
    }

    @Override
    public List<Integer> select(List<ConversationTurn> turns, int[] costs, int budget, Set<String> priorityRoles) {
        if (turns.isEmpty()) {
            return List.of();
        }
        boolean[] keptTurns = new boolean[turns.size()];
        int latestIndex = turns.size() - 1;
        keptTurns[latestIndex] = true;
        int keptTotal = turnCost(turns.get(latestIndex), costs);
        int turnsKept = 1;

        for (int turnIndex = latestIndex - 1; turnIndex >= 0; turnIndex--) {
            ConversationTurn turn = turns.get(turnIndex);
            int cost = turnCost(turn, costs);
            boolean fits = keptTotal + cost <= budget;
            if (fits || turnsKept < minTurns || turn.hasPriorityRole(priorityRoles)) {
                keptTurns[turnIndex] = true;
                keptTotal += cost;
                turnsKept++;
            }
        }

        List<Integer> kept = new ArrayList<>();
        for (int turnIndex = 0; turnIndex < turns.size(); turnIndex++) {
            if (keptTurns[turnIndex]) {
                ConversationTurn turn = turns.get(turnIndex);
                for (int position = turn.startIndex(); position < turn.endIndex(); position++) {
                    kept.add(position);
                }
            }
        }
        return List.copyOf(kept);
    }

    private static int turnCost(ConversationTurn turn, int[] costs) {
        int total = 0;
        for (int position = turn.startIndex(); position < turn.endIndex(); position++) {
            total += costs[position];
        }
        return total;
    }

    public int minTurns() {
        return minTurns;
    }
}
