package com.hybridai.gateway.model;

import java.util.Objects;

/**
 * One turn of a conversation: a role paired with its text content.
 *
 * <p>An ordered list of messages is forwarded to whichever provider is
 * attempted; the dispatcher never inspects or rewrites it.
 */
public final class ChatMessage {

    public enum Role {
        SYSTEM("system"),
        USER("user"),
        ASSISTANT("assistant");

        private final String wireName;

        Role(final String wireName) { this.wireName = wireName; }

        public String wireName() { return wireName; }
    }

    private final Role   role;
    private final String content;

    public ChatMessage(final Role role, final String content) {
        this.role    = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static ChatMessage system(final String content)    { return new ChatMessage(Role.SYSTEM, content); }
    public static ChatMessage user(final String content)      { return new ChatMessage(Role.USER, content); }
    public static ChatMessage assistant(final String content) { return new ChatMessage(Role.ASSISTANT, content); }

    public Role   getRole()    { return role; }
    public String getContent() { return content; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessage)) return false;
        final ChatMessage other = (ChatMessage) o;
        return role == other.role && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }

    @Override
    public String toString() {
        // Content may hold user data; keep log lines short
        return "ChatMessage{role=" + role.wireName() + ", length=" + content.length() + "}";
    }
}
