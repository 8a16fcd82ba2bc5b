package com.williamcallahan.contextbudget.application.trim;

import com.williamcallahan.contextbudget.application.tokens.JtokkitTokenizerRegistry;
import com.williamcallahan.contextbudget.application.tokens.TokenCounter;
import com.williamcallahan.contextbudget.application.tokens.TokenCounterFactory;
import com.williamcallahan.contextbudget.domain.conversation.ChatMessage;
import com.williamcallahan.contextbudget.domain.trim.TrimMetrics;
import com.williamcallahan.contextbudget.domain.trim.TrimResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies end-to-end trimming: retention guarantees, both selection modes and metrics.
 */
class ContextTrimmerTest {

    private static final String LEGACY_MODEL = "legacy-model";

    private TokenCounterFactory tokenCounterFactory;
    private ContextTrimmer trimmer;

    @BeforeEach
    void setUp() {
        tokenCounterFactory = new TokenCounterFactory(new JtokkitTokenizerRegistry());
        trimmer = new ContextTrimmer(tokenCounterFactory, BudgetAllocator.DEFAULT_FLOOR_TOKENS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"gpt-5-main", "gpt-4o", "gpt-4"})
    void countsTokensWithModelEncoding(String model) {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("You are a concise assistant."),
                ChatMessage.user("Summarize the Katamari history and mechanics."),
                ChatMessage.assistant("Katamari Damacy is a puzzle-action game by Namco."),
                ChatMessage.user("Provide bullet points and notable releases."));

        TrimResult result = trimmer.trim(messages, 4096, model);

        TokenCounter counter = tokenCounterFactory.forModel(model);
        int expected = 0;
        for (ChatMessage message : messages) {
            expected += counter.count(message.content());
        }
        assertEquals("tiktoken", result.metrics().tokenCounter().mode());
        assertEquals(expected, result.metrics().inputTokens());
        assertEquals(expected, result.metrics().outputTokens());
        assertEquals(messages, result.messages());
    }

    @Test
    void compressRatioMatchesRoundedTokenRatio() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("x".repeat(800)),
                ChatMessage.assistant("y".repeat(400)),
                ChatMessage.user("z".repeat(400)));

        TrimResult result = trimmer.trim(messages, 16, LEGACY_MODEL);

        TrimMetrics metrics = result.metrics();
        assertEquals("heuristic", metrics.tokenCounter().mode());
        assertEquals(List.of(messages.get(0), messages.get(2), messages.get(3)), result.messages());
        assertEquals(401, metrics.inputTokens());
        assertEquals(201, metrics.outputTokens());
        double expected = new BigDecimal((double) metrics.outputTokens() / metrics.inputTokens())
                .setScale(3, RoundingMode.HALF_EVEN)
                .doubleValue();
        assertEquals(expected, metrics.compressRatio());
        assertEquals(0.501, metrics.compressRatio());
        assertNull(metrics.semanticRetention());
    }

    @Test
    void minTurnsKeepsOlderTurnPastBudget() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("first".repeat(400)),
                ChatMessage.assistant("reply"),
                ChatMessage.user("second"));

        TrimResult result = trimmer.trim(messages, 128, LEGACY_MODEL, 2, Set.of());

        assertEquals(messages, result.messages());
    }

    @Test
    void messageModeKeepsLatestUserOverBudget() {
        ChatMessage finalMessage = ChatMessage.user("final".repeat(2000));
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("small talk"),
                ChatMessage.assistant("ack"),
                finalMessage);

        TrimResult result = trimmer.trim(messages, 16, LEGACY_MODEL, 0, Set.of());

        assertEquals(List.of(messages.get(0), finalMessage), result.messages());
    }

    @Test
    void turnModeKeepsLatestUserOverBudget() {
        ChatMessage finalMessage = ChatMessage.user("final".repeat(4096));
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("opening"),
                ChatMessage.assistant("short reply"),
                finalMessage);

        TrimResult result = trimmer.trim(messages, 32, LEGACY_MODEL, 1, Set.of());

        assertEquals(List.of(messages.get(0), finalMessage), result.messages());
    }

    @Test
    void shortConversationIsKeptWhole() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("a".repeat(100)),
                ChatMessage.assistant("b".repeat(100)));

        assertEquals(messages, trimmer.trim(messages, 16, LEGACY_MODEL).messages());
    }

    @Test
    void minTurnsKeepsWholeTurnsEvenOverBudget() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("intro".repeat(400)),
                ChatMessage.assistant("short"),
                ChatMessage.user("follow up"),
                ChatMessage.assistant("dense".repeat(400)),
                ChatMessage.user("final question"),
                ChatMessage.assistant("final reply"));

        TrimResult result = trimmer.trim(messages, 64, LEGACY_MODEL, 2, Set.of());

        assertEquals(List.of(
                messages.get(0),
                messages.get(3),
                messages.get(4),
                messages.get(5),
                messages.get(6)), result.messages());
    }

    @Test
    void systemTokensCountAgainstBudget() {
        TokenCounter counter = tokenCounterFactory.forModel("gpt-4o");
        String systemContent = "sys ".repeat(400);
        int targetTokens = counter.count(systemContent) + 48;
        List<ChatMessage> messages = List.of(
                ChatMessage.system(systemContent),
                ChatMessage.user("u".repeat(800)),
                ChatMessage.assistant("a".repeat(200)),
                ChatMessage.user("short question"));

        TrimResult result = trimmer.trim(messages, targetTokens, "gpt-4o");

        assertTrue(result.metrics().outputTokens() <= targetTokens);
        assertEquals(messages.get(3), result.messages().get(result.messages().size() - 1));
    }

    @Test
    void systemTokensCountAgainstBudgetWithMinTurns() {
        TokenCounter counter = tokenCounterFactory.forModel("gpt-4o");
        String systemContent = "sys ".repeat(400);
        int targetTokens = counter.count(systemContent) + 64;
        List<ChatMessage> messages = List.of(
                ChatMessage.system(systemContent),
                ChatMessage.user("first".repeat(800)),
                ChatMessage.assistant("reply".repeat(200)),
                ChatMessage.user("second question"),
                ChatMessage.assistant("short reply"),
                ChatMessage.user("final question"),
                ChatMessage.assistant("concise answer"));

        TrimResult result = trimmer.trim(messages, targetTokens, "gpt-4o", 2, Set.of());

        assertTrue(result.metrics().outputTokens() <= targetTokens);
        assertEquals(List.of(messages.get(0), messages.get(3), messages.get(4), messages.get(5), messages.get(6)),
                result.messages());
    }

    @Test
    void priorityRolesArePreservedOverBudget() {
        ChatMessage developer = new ChatMessage("developer", "details".repeat(600));
        ChatMessage intro = ChatMessage.user("intro".repeat(200));
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                intro,
                ChatMessage.assistant("ack"),
                developer,
                ChatMessage.user("final question"));

        TrimResult result = trimmer.trim(messages, 128, LEGACY_MODEL, 0, Set.of("developer"));

        assertTrue(result.messages().contains(developer));
        assertEquals(ChatMessage.user("final question"), result.messages().get(result.messages().size() - 1));
        assertFalse(result.messages().contains(intro));
    }

    @Test
    void oversizedMessageBetweenForcedMessagesIsSkippedNotBlocking() {
        ChatMessage developer = new ChatMessage("developer", "details".repeat(400));
        ChatMessage overflow = ChatMessage.assistant("overflow".repeat(4000));
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                developer,
                overflow,
                ChatMessage.user("latest"));

        TrimResult result = trimmer.trim(messages, 128, LEGACY_MODEL, 0, Set.of("developer"));

        assertEquals(List.of(messages.get(0), developer, messages.get(3)), result.messages());
    }

    @Test
    void tinyTargetBehavesLikeFloor() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("q".repeat(600)),
                ChatMessage.assistant("r".repeat(300)),
                ChatMessage.user("s".repeat(400)));

        TrimResult tiny = trimmer.trim(messages, 1, "legacy", 0, Set.of());
        TrimResult floor = trimmer.trim(messages, BudgetAllocator.DEFAULT_FLOOR_TOKENS, "legacy", 0, Set.of());

        assertEquals(floor, tiny);
        assertEquals(List.of(messages.get(0), messages.get(2), messages.get(3)), tiny.messages());
    }

    @Test
    void onlyFirstSystemMessageIsKeptUnlessSystemIsPinned() {
        ChatMessage secondSystem = ChatMessage.system("Also follow the style guide.");
        List<ChatMessage> messages = List.of(
                ChatMessage.system("Primary instructions."),
                ChatMessage.user("question"),
                secondSystem,
                ChatMessage.assistant("answer"));

        assertFalse(trimmer.trim(messages, 4096, LEGACY_MODEL).messages().contains(secondSystem));
        assertEquals(messages, trimmer.trim(messages, 4096, LEGACY_MODEL, 0, Set.of("system")).messages());
    }

    @Test
    void negativeMinTurnsBehavesLikeZero() {
        List<ChatMessage> messages = List.of(
                ChatMessage.user("first".repeat(400)),
                ChatMessage.assistant("reply"),
                ChatMessage.user("second"));

        assertEquals(trimmer.trim(messages, 16, LEGACY_MODEL, 0, Set.of()),
                trimmer.trim(messages, 16, LEGACY_MODEL, -3, Set.of()));
    }

    @Test
    void nullPriorityRoleEntriesAreIgnored() {
        ChatMessage developer = new ChatMessage("developer", "d".repeat(2000));
        List<ChatMessage> messages = List.of(developer, ChatMessage.user("latest"));

        TrimResult result = trimmer.trim(messages, 16, LEGACY_MODEL, 0, Arrays.asList("developer", null));

        assertEquals(messages, result.messages());
    }

    @Test
    void emptyConversationYieldsEmptyResult() {
        TrimResult result = trimmer.trim(List.of(), 512, "gpt-4o");

        assertTrue(result.messages().isEmpty());
        assertEquals(0, result.metrics().inputTokens());
        assertEquals(0, result.metrics().outputTokens());
        assertEquals(0.0, result.metrics().compressRatio());
        assertTrue(trimmer.trim(null, 512, "gpt-4o", 0, null).messages().isEmpty());
    }

    @Test
    void systemOnlyInputKeepsFirstSystemMessage() {
        List<ChatMessage> messages = List.of(ChatMessage.system("only instructions"));

        assertEquals(messages, trimmer.trim(messages, 512, LEGACY_MODEL).messages());
    }

    @Test
    void identicalInputsProduceIdenticalResults() {
        List<ChatMessage> messages = List.of(
                ChatMessage.system("System"),
                ChatMessage.user("w".repeat(900)),
                ChatMessage.assistant("v".repeat(900)),
                ChatMessage.user("latest"));

        TrimResult first = trimmer.trim(messages, 200, "gpt-4o", 0, Set.of("assistant"));
        TrimResult second = trimmer.trim(messages, 200, "gpt-4o", 0, Set.of("assistant"));

        assertEquals(first, second);
    }

    @Test
    void randomConversationsHonorRetentionGuarantees() {
        Random random = new Random(20240611L);
        String[] roles = {"system", "user", "user", "assistant", "assistant", "developer", "tool"};
        for (int iteration = 0; iteration < 200; iteration++) {
            int size = 1 + random.nextInt(14);
            List<ChatMessage> messages = new ArrayList<>();
            for (int position = 0; position < size; position++) {
                String role = roles[random.nextInt(roles.length)];
                String content = "m" + position + "-" + "t".repeat(random.nextInt(1600));
                messages.add(new ChatMessage(role, content));
            }
            Set<String> priorityRoles = random.nextBoolean() ? Set.of("developer") : Set.of();
            int minTurns = random.nextInt(4) - 1;
            int target = random.nextInt(1200);

            TrimResult result = trimmer.trim(messages, target, LEGACY_MODEL, minTurns, priorityRoles);

            assertSubsequence(messages, result.messages());
            for (ChatMessage required : requiredMessages(messages, priorityRoles)) {
                assertTrue(result.messages().contains(required),
                        "missing " + required.role() + " message in iteration " + iteration);
            }
            TrimMetrics metrics = result.metrics();
            assertTrue(metrics.outputTokens() <= metrics.inputTokens());
            assertTrue(metrics.compressRatio() >= 0.0 && metrics.compressRatio() <= 1.0);
        }
    }

    private static void assertSubsequence(List<ChatMessage> input, List<ChatMessage> output) {
        int cursor = 0;
        for (ChatMessage kept : output) {
            while (cursor < input.size() && !input.get(cursor).equals(kept)) {
                cursor++;
            }
            assertTrue(cursor < input.size(), "output is not an ordered subsequence of the input");
            cursor++;
        }
    }

    private static List<ChatMessage> requiredMessages(List<ChatMessage> input, Set<String> priorityRoles) {
        List<ChatMessage> conversation = new ArrayList<>();
        for (ChatMessage message : input) {
            if (!message.hasRole(ChatMessage.ROLE_SYSTEM)) {
                conversation.add(message);
            }
        }
        int latestTurnStart = 0;
        for (int position = 0; position < conversation.size(); position++) {
            if (conversation.get(position).hasRole(ChatMessage.ROLE_USER)) {
                latestTurnStart = position;
            }
        }
        List<ChatMessage> required = new ArrayList<>(conversation.subList(latestTurnStart, conversation.size()));
        for (ChatMessage message : conversation) {
            if (priorityRoles.contains(message.role())) {
                required.add(message);
            }
        }
        for (ChatMessage message : input) {
            if (message.hasRole(ChatMessage.ROLE_SYSTEM)) {
                required.add(message);
                break;
            }
        }
        return required;
    }
}
