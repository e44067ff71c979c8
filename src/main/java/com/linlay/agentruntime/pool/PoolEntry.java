package com.linlay.agentruntime.pool;

import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable projection of a pooled agent.
 */
public record PoolEntry(
        String agentId,
        String agentType,
        String tenantId,
        AgentStatus status,
        Instant createdAt,
        Instant lastActivity,
        Map<String, Object> collectedFields,
        Map<String, Object> executionState,
        Map<String, Object> context,
        String checkpointId,
        int schemaVersion
) {

    public PoolEntry {
        collectedFields = frozen(collectedFields);
        executionState = frozen(executionState);
        context = frozen(context);
    }

    public static PoolEntry of(Agent agent, int schemaVersion, String checkpointId) {
        return new PoolEntry(
                agent.id(),
                agent.type(),
                agent.tenantId(),
                agent.status(),
                agent.createdAt(),
                agent.lastActivity(),
                agent.collectedFields(),
                agent.executionState(),
                agent.context(),
                checkpointId,
                schemaVersion
        );
    }

    private static Map<String, Object> frozen(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
