package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.application.tokens.TokenCounter;
import com.williamcallahan.contextbudget.application.tokens.TokenCounterFactory;
import com.williamcallahan.contextbudget.config.AppProperties;
import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.domain.conversation.ConversationTurn;
import com.williamcallahan.contextbudget.domain.trim.TrimResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fits a chat conversation into a token budget while keeping it coherent.
 *
 * <p>Guarantees for every call:
 * <ol>
 *   <li>Output is an order-preserving subsequence of the input</li>
 *   <li>The latest turn is always retained, even when it alone exceeds the budget</li>
 *   <li>Every message whose role is a priority role is retained</li>
 *   <li>The first system message is retained; later ones only if "system" is a priority role</li>
 * </ol>
 *
 * <p>{@code minTurns == 0} selects messages individually ({@link MessagePreservingSelector});
 * {@code minTurns > 0} selects whole turns ({@link TurnPreservingSelector}). The trimmer
 * holds no per-call state and may be called concurrently.</p>
 */
@Component
public class ContextTrimmer {

    private static final Logger log = LoggerFactory.getLogger(ContextTrimmer.class);

    private static final SelectionStrategy MESSAGE_PRESERVING = new MessagePreservingSelector();

    private final TokenCounterFactory tokenCounterFactory;
    private final BudgetAllocator budgetAllocator;
    private final TurnGrouper turnGrouper = new TurnGrouper();
    private final TrimMetricsReporter metricsReporter = new TrimMetricsReporter();

    @Autowired
    public ContextTrimmer(TokenCounterFactory tokenCounterFactory, AppProperties appProperties) {
        this(tokenCounterFactory, appProperties.getTrim().getFloorTokens());
    }

    /**
     * Creates a trimmer with an explicit budget floor.
     *
     * @param tokenCounterFactory source of per-model token counters
     * @param floorTokens minimum usable budget
     */
    public ContextTrimmer(TokenCounterFactory tokenCounterFactory, int floorTokens) {
        if (tokenCounterFactory == null) {
            throw new IllegalArgumentException("Token counter factory cannot be null");
        }
        this.tokenCounterFactory = tokenCounterFactory;
        this.budgetAllocator = new BudgetAllocator(floorTokens);
    }

    /**
     * Trims with message-level selection and no priority roles.
     *
     * @param messages conversation including system messages
     * @param targetTokens desired token budget
     * @param model model identifier used to pick the cost model
     * @return retained messages and compression metrics
     */
    public TrimResult trim(List<ChatMessage> messages, int targetTokens, String model) {
        return trim(messages, targetTokens, model, 0, Set.of());
    }

    /**
     * Trims a conversation to fit a token budget.
     *
     * @param messages conversation including system messages; null is treated as empty
     * @param targetTokens desired token budget; values below the floor are raised to it
     * @param model model identifier used to pick the cost model
     * @param minTurns minimum turns to keep; 0 selects message-level trimming, negatives clamp to 0
     * @param priorityRoles roles whose messages are never dropped; null is treated as empty
     * @return retained messages and compression metrics
     */
    public TrimResult trim(
            List<ChatMessage> messages, int targetTokens, String model, int minTurns, Collection<String> priorityRoles) {
        TokenCounter counter = tokenCounterFactory.forModel(model);
        List<ChatMessage> input = messages == null ? List.of() : messages;
        Set<String> pinnedRoles = pinnedRoles(priorityRoles);
        int requiredTurns = Math.max(0, minTurns);

        int[] inputCosts = new int[input.size()];
        List<ChatMessage> systemMessages = new ArrayList<>();
        List<Integer> systemInputPositions = new ArrayList<>();
        List<ChatMessage> conversation = new ArrayList<>();
        List<Integer> conversationInputPositions = new ArrayList<>();
        for (int position = 0; position < input.size(); position++) {
            ChatMessage message = input.get(position);
            inputCosts[position] = counter.count(message.content());
            if (message.hasRole(ChatMessage.ROLE_SYSTEM)) {
                systemMessages.add(message);
                systemInputPositions.add(position);
            } else {
                conversation.add(message);
                conversationInputPositions.add(position);
            }
        }

        BudgetAllocation allocation = budgetAllocator.allocate(targetTokens, systemMessages, pinnedRoles, counter);

        int[] conversationCosts = new int[conversation.size()];
        for (int position = 0; position < conversation.size(); position++) {
            conversationCosts[position] = inputCosts[conversationInputPositions.get(position)];
        }
        List<ConversationTurn> turns = turnGrouper.group(conversation);
        SelectionStrategy strategy =
                requiredTurns > 0 ? new TurnPreservingSelector(requiredTurns) : MESSAGE_PRESERVING;
        List<Integer> selected =
                strategy.select(turns, conversationCosts, allocation.remainingBudget(), pinnedRoles);

        boolean[] keep = new boolean[input.size()];
        for (int systemPosition : allocation.keptSystemPositions()) {
            keep[systemInputPositions.get(systemPosition)] = true;
        }
        for (int conversationPosition : selected) {
            keep[conversationInputPositions.get(conversationPosition)] = true;
        }
        List<ChatMessage> output = new ArrayList<>();
        List<Integer> keptPositions = new ArrayList<>();
        for (int position = 0; position < input.size(); position++) {
            if (keep[position]) {
                output.add(input.get(position));
                keptPositions.add(position);
            }
        }

        TrimResult result = new TrimResult(output, metricsReporter.report(inputCosts, keptPositions, counter.describe()));
        if (output.size() < input.size()) {
            log.debug(
                    "Trimmed {} messages to {} ({} turns, budget {} after {} system tokens, min turns {})",
                    input.size(),
                    output.size(),
                    turns.size(),
                    allocation.remainingBudget(),
                    allocation.systemTokens(),
                    requiredTurns);
        }
        return result;
    }

    private static Set<String> pinnedRoles(Collection<String> priorityRoles) {
        if (priorityRoles == null || priorityRoles.isEmpty()) {
            return Set.of();
        }
        Set<String> roles = new HashSet<>(priorityRoles);
        roles.remove(null);
        return Set.copyOf(roles);
    }

    public int floorTokens() {
        return budgetAllocator.floorTokens();
    }
}
