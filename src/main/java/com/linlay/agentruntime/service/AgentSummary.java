package com.linlay.agentruntime.service;

import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentStatus;

import java.time.Instant;
import java.util.Map;

public record AgentSummary(
        String agentId,
        String agentType,
        AgentStatus status,
        Instant createdAt,
        Instant lastActivity,
        Map<String, Object> collectedFields
) {

    public static AgentSummary of(Agent agent) {
        return new AgentSummary(
                agent.id(),
                agent.type(),
                agent.status(),
                agent.createdAt(),
                agent.lastActivity(),
                agent.collectedFields()
        );
    }
}
