package com.linlay.agentruntime.agent;

import java.time.Instant;
import java.util.Map;

public interface Agent {

    String id();

    String type();

    String tenantId();

    AgentStatus status();

    Map<String, Object> collectedFields();

    Map<String, Object> executionState();

    Map<String, Object> context();

    default Instant createdAt() {
        return Instant.EPOCH;
    }

    default Instant lastActivity() {
        return createdAt();
    }

    default String approvalPrompt() {
        return "";
    }

    AgentReply reply(String message);

    AgentReply pause();

    AgentReply resume(String message);

    /**
     * Moves the agent to {@code target}. Implementations reject transitions the state machine forbids.
     */
    void transitionTo(AgentStatus target);

    /**
     * Rehydrates state from a persisted snapshot without running any transition checks.
     */
    void restoreState(
            String agentId,
            AgentStatus status,
            Map<String, Object> collectedFields,
            Map<String, Object> executionState,
            Map<String, Object> context
    );
}
