package com.linlay.agentruntime.llm;

public record TokenUsage(
        long inputTokens,
        long outputTokens
) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public TokenUsage {
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
    }
}
