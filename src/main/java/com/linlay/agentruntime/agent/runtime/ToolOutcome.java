package com.linlay.agentruntime.agent.runtime;

/**
 * Result of one dispatched tool call. Failures are data: {@code content} carries the error text the
 * model will see and {@code success} is false.
 */
public record ToolOutcome(
        String callId,
        String toolName,
        String content,
        boolean success,
        String resultStatus,
        boolean agentTool,
        boolean completed,
        String agentId,
        ApprovalRequest approvalRequest,
        long durationMs
) {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_TIMEOUT = "timeout";
    public static final String STATUS_DENIED = "denied";

    public ToolOutcome {
        content = content == null ? "" : content;
        resultStatus = resultStatus == null ? (success ? STATUS_SUCCESS : STATUS_ERROR) : resultStatus;
    }

    static ToolOutcome success(String callId, String toolName, String content, long durationMs) {
        return new ToolOutcome(callId, toolName, content, true, STATUS_SUCCESS, false, true, null, null, durationMs);
    }

    static ToolOutcome failure(String callId, String toolName, String content, String status, long durationMs) {
        return new ToolOutcome(callId, toolName, content, false, status, false, true, null, null, durationMs);
    }

    ToolOutcome withContent(String newContent) {
        return new ToolOutcome(callId, toolName, newContent, success, resultStatus, agentTool, completed, agentId,
                approvalRequest, durationMs);
    }

    ToolOutcome withDuration(long newDurationMs) {
        return new ToolOutcome(callId, toolName, content, success, resultStatus, agentTool, completed, agentId,
                approvalRequest, newDurationMs);
    }

    /**
     * True when an agent-tool stopped to ask the user something and the loop has to hand control back.
     */
    public boolean needsUser() {
        return agentTool && !completed;
    }
}
