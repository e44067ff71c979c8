package com.linlay.agentruntime.agent.runtime;

import java.time.Duration;

public record ReactLoopConfig(
        int maxTurns,
        Duration toolExecutionTimeout,
        Duration agentToolExecutionTimeout,
        double maxToolResultShare,
        int maxToolResultChars,
        int contextTokenLimit,
        double contextTrimThreshold,
        int maxHistoryMessages,
        int llmMaxRetries,
        Duration llmRetryBaseDelay,
        int approvalTimeoutMinutes
) {

    private static final int DEFAULT_MAX_TURNS = 10;
    private static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_AGENT_TOOL_TIMEOUT = Duration.ofSeconds(120);
    private static final double DEFAULT_TOOL_RESULT_SHARE = 0.3;
    private static final int DEFAULT_TOOL_RESULT_CHARS = 400_000;
    private static final int DEFAULT_CONTEXT_TOKEN_LIMIT = 128_000;
    private static final double DEFAULT_TRIM_THRESHOLD = 0.8;
    private static final int DEFAULT_MAX_HISTORY = 40;
    private static final int DEFAULT_LLM_RETRIES = 2;
    private static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    private static final int DEFAULT_APPROVAL_TIMEOUT_MINUTES = 30;

    public static final ReactLoopConfig DEFAULT = new ReactLoopConfig(
            DEFAULT_MAX_TURNS,
            DEFAULT_TOOL_TIMEOUT,
            DEFAULT_AGENT_TOOL_TIMEOUT,
            DEFAULT_TOOL_RESULT_SHARE,
            DEFAULT_TOOL_RESULT_CHARS,
            DEFAULT_CONTEXT_TOKEN_LIMIT,
            DEFAULT_TRIM_THRESHOLD,
            DEFAULT_MAX_HISTORY,
            DEFAULT_LLM_RETRIES,
            DEFAULT_RETRY_BASE_DELAY,
            DEFAULT_APPROVAL_TIMEOUT_MINUTES
    );

    public ReactLoopConfig {
        maxTurns = maxTurns > 0 ? maxTurns : DEFAULT_MAX_TURNS;
        toolExecutionTimeout = positiveOr(toolExecutionTimeout, DEFAULT_TOOL_TIMEOUT);
        agentToolExecutionTimeout = positiveOr(agentToolExecutionTimeout, DEFAULT_AGENT_TOOL_TIMEOUT);
        maxToolResultShare = maxToolResultShare > 0 && maxToolResultShare <= 1 ? maxToolResultShare : DEFAULT_TOOL_RESULT_SHARE;
        maxToolResultChars = maxToolResultChars > 0 ? maxToolResultChars : DEFAULT_TOOL_RESULT_CHARS;
        contextTokenLimit = contextTokenLimit > 0 ? contextTokenLimit : DEFAULT_CONTEXT_TOKEN_LIMIT;
        contextTrimThreshold = contextTrimThreshold > 0 && contextTrimThreshold <= 1 ? contextTrimThreshold : DEFAULT_TRIM_THRESHOLD;
        maxHistoryMessages = maxHistoryMessages > 0 ? maxHistoryMessages : DEFAULT_MAX_HISTORY;
        llmMaxRetries = Math.max(0, llmMaxRetries);
        llmRetryBaseDelay = llmRetryBaseDelay == null || llmRetryBaseDelay.isNegative() ? DEFAULT_RETRY_BASE_DELAY : llmRetryBaseDelay;
        approvalTimeoutMinutes = approvalTimeoutMinutes > 0 ? approvalTimeoutMinutes : DEFAULT_APPROVAL_TIMEOUT_MINUTES;
    }

    public ReactLoopConfig withMaxTurns(int turns) {
        return new ReactLoopConfig(turns, toolExecutionTimeout, agentToolExecutionTimeout, maxToolResultShare,
                maxToolResultChars, contextTokenLimit, contextTrimThreshold, maxHistoryMessages, llmMaxRetries,
                llmRetryBaseDelay, approvalTimeoutMinutes);
    }

    public ReactLoopConfig withToolTimeouts(Duration tool, Duration agentTool) {
        return new ReactLoopConfig(maxTurns, tool, agentTool, maxToolResultShare, maxToolResultChars,
                contextTokenLimit, contextTrimThreshold, maxHistoryMessages, llmMaxRetries, llmRetryBaseDelay,
                approvalTimeoutMinutes);
    }

    public ReactLoopConfig withContextWindow(int tokenLimit, double trimThreshold, int historyMessages) {
        return new ReactLoopConfig(maxTurns, toolExecutionTimeout, agentToolExecutionTimeout, maxToolResultShare,
                maxToolResultChars, tokenLimit, trimThreshold, historyMessages, llmMaxRetries, llmRetryBaseDelay,
                approvalTimeoutMinutes);
    }

    public ReactLoopConfig withLlmRetries(int retries, Duration baseDelay) {
        return new ReactLoopConfig(maxTurns, toolExecutionTimeout, agentToolExecutionTimeout, maxToolResultShare,
                maxToolResultChars, contextTokenLimit, contextTrimThreshold, maxHistoryMessages, retries, baseDelay,
                approvalTimeoutMinutes);
    }

    public ReactLoopConfig withToolResultLimits(double share, int chars) {
        return new ReactLoopConfig(maxTurns, toolExecutionTimeout, agentToolExecutionTimeout, share, chars,
                contextTokenLimit, contextTrimThreshold, maxHistoryMessages, llmMaxRetries, llmRetryBaseDelay,
                approvalTimeoutMinutes);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
