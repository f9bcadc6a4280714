package com.hivemind.core.llm;

/**
 * One entry of an agent's conversation history.
 */
public record ChatTurn(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public ChatTurn {
        content = content == null ? "" : content;
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content);
    }
}
