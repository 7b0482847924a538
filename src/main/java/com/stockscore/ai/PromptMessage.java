package com.stockscore.ai;

/**
 * Role-tagged chat entry sent to the model service.
 */
public record PromptMessage(Role role, String content) {
    public enum Role {
        SYSTEM,
        USER
    }

    public PromptMessage {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        content = content == null ? "" : content;
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(Role.SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(Role.USER, content);
    }
}
