package com.linlay.agentruntime.service;

import com.linlay.agentruntime.agent.AgentReply;
import com.linlay.agentruntime.agent.runtime.ApprovalRequest;
import com.linlay.agentruntime.agent.runtime.ReactLoopResult;

import java.util.List;

/**
 * What the caller gets back for one user message. Exactly one of {@code agentReply} (message routed to a
 * waiting agent) and {@code loopResult} (message handled by the ReAct loop) is set.
 */
public record OrchestratorReply(
        String tenantId,
        String response,
        AgentReply agentReply,
        ReactLoopResult loopResult,
        List<ApprovalRequest> pendingApprovals
) {

    public OrchestratorReply {
        response = response == null ? "" : response;
        pendingApprovals = pendingApprovals == null ? List.of() : List.copyOf(pendingApprovals);
    }

    static OrchestratorReply fromAgent(String tenantId, AgentReply reply, List<ApprovalRequest> pending) {
        String text = reply.errorMessage() != null ? "Error: " + reply.errorMessage() : reply.rawMessage();
        return new OrchestratorReply(tenantId, text, reply, null, pending);
    }

    static OrchestratorReply fromLoop(String tenantId, ReactLoopResult result) {
        return new OrchestratorReply(tenantId, result.response(), null, result, result.pendingApprovals());
    }

    public boolean routedToAgent() {
        return agentReply != null;
    }
}
