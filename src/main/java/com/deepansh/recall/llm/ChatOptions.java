package com.deepansh.recall.llm;

/**
 * Per-call overrides. Null fields fall back to the provider defaults.
 * Summaries and extraction need more output tokens than a chat reply.
 */
public record ChatOptions(Integer maxTokens, Double temperature) {

    public static ChatOptions defaults() {
        return new ChatOptions(null, null);
    }
}
