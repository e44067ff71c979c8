package com.linlay.agentruntime.agent.runtime;

/**
 * Per-call telemetry returned with a loop result.
 */
public record ToolCallRecord(
        String name,
        String argsSummary,
        long durationMs,
        boolean success,
        String resultStatus,
        int resultChars,
        int tokenAttribution
) {

    static final int ARGS_SUMMARY_LIMIT = 200;

    static String summarize(String arguments) {
        if (arguments == null) {
            return "";
        }
        return arguments.length() <= ARGS_SUMMARY_LIMIT ? arguments : arguments.substring(0, ARGS_SUMMARY_LIMIT);
    }
}
