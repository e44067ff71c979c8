package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.llm.TokenUsage;

import java.util.List;

public record ReactLoopResult(
        String response,
        int turns,
        List<ToolCallRecord> toolCalls,
        TokenUsage tokenUsage,
        long durationMs,
        List<ApprovalRequest> pendingApprovals
) {

    public ReactLoopResult {
        response = response == null ? "" : response;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        tokenUsage = tokenUsage == null ? TokenUsage.EMPTY : tokenUsage;
        pendingApprovals = pendingApprovals == null ? List.of() : List.copyOf(pendingApprovals);
    }

    public boolean hasPendingApprovals() {
        return !pendingApprovals.isEmpty();
    }
}
