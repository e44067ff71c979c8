package com.linlay.agentruntime.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link Agent#reply(String)}, {@link Agent#pause()} or {@link Agent#resume(String)} call.
 */
public record AgentReply(
        String agentId,
        String agentType,
        AgentStatus status,
        String rawMessage,
        Map<String, Object> collectedFields,
        String errorMessage,
        Map<String, Object> metadata
) {

    public AgentReply {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        rawMessage = rawMessage == null ? "" : rawMessage;
        collectedFields = collectedFields == null ? Map.of() : copyOf(collectedFields);
        metadata = metadata == null ? Map.of() : copyOf(metadata);
    }

    public static AgentReply of(Agent agent, String rawMessage) {
        return new AgentReply(
                agent.id(),
                agent.type(),
                agent.status(),
                rawMessage,
                agent.collectedFields(),
                null,
                Map.of()
        );
    }

    public static AgentReply error(Agent agent, String errorMessage) {
        return new AgentReply(
                agent.id(),
                agent.type(),
                AgentStatus.ERROR,
                "",
                agent.collectedFields(),
                errorMessage,
                Map.of()
        );
    }

    public AgentReply withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new AgentReply(agentId, agentType, status, rawMessage, collectedFields, errorMessage, merged);
    }

    public boolean isCompleted() {
        return status == AgentStatus.COMPLETED;
    }

    public boolean isWaiting() {
        return status.isWaiting();
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        // values may be null, so Map.copyOf is not an option
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
