package com.williamcallahan.contextbudget.domain.conversation;

/**
 * A single chat message as exchanged with the chat orchestration loop.
 *
 * <p>The role is an open tag rather than an enum: callers may pin arbitrary roles
 * (for example {@code "developer"} or {@code "tool"}) as always-retained.</p>
 *
 * @param role participant role, such as "system", "user" or "assistant"
 * @param content message text; never null after construction
 */
public record ChatMessage(String role, String content) {

    /** Role constant for system instructions. */
    public static final String ROLE_SYSTEM = "system";

    /** Role constant for user messages, which open a new turn. */
    public static final String ROLE_USER = "user";

    /** Role constant for assistant replies. */
    public static final String ROLE_ASSISTANT = "assistant";

    /**
     * Creates a chat message, normalizing missing content to the empty string.
     *
     * @throws IllegalArgumentException if role is null
     */
    public ChatMessage {
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (content == null) {
            content = "";
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(ROLE_SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content);
    }

    /**
     * Checks whether this message carries the given role.
     *
     * @param candidate role to compare against
     * @return true if the roles are equal
     */
    public boolean hasRole(String candidate) {
        return role.equals(candidate);
    }
}
