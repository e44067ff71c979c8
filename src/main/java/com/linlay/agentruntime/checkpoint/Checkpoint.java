package com.linlay.agentruntime.checkpoint;

import com.linlay.agentruntime.agent.AgentStatus;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of an agent taken after a state transition. Checkpoints of one agent form a tree
 * through {@link #parentCheckpointId()}.
 */
public record Checkpoint(
        String id,
        String agentId,
        String agentType,
        String tenantId,
        AgentStatus status,
        Map<String, Object> collectedFields,
        Map<String, Object> executionState,
        Map<String, Object> context,
        Map<String, Object> message,
        Map<String, Object> result,
        List<Map<String, Object>> messageHistory,
        String parentCheckpointId,
        String branchLabel,
        Instant timestamp,
        int version
) {

    public static final int CURRENT_VERSION = 1;

    public Checkpoint {
        if (!StringUtils.hasText(agentId)) {
            throw new IllegalArgumentException("checkpoint agentId must not be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("checkpoint status must not be null");
        }
        id = StringUtils.hasText(id) ? id.trim() : newId();
        agentType = agentType == null ? "" : agentType;
        tenantId = tenantId == null ? "" : tenantId;
        collectedFields = frozen(collectedFields);
        executionState = frozen(executionState);
        context = frozen(context);
        message = message == null ? null : frozen(message);
        result = result == null ? null : frozen(result);
        messageHistory = messageHistory == null ? List.of() : messageHistory.stream().map(Checkpoint::frozen).toList();
        parentCheckpointId = StringUtils.hasText(parentCheckpointId) ? parentCheckpointId.trim() : null;
        branchLabel = StringUtils.hasText(branchLabel) ? branchLabel.trim() : null;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        version = version > 0 ? version : CURRENT_VERSION;
    }

    public static String newId() {
        return "ckpt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public Checkpoint withParent(String parentId) {
        return new Checkpoint(id, agentId, agentType, tenantId, status, collectedFields, executionState, context,
                message, result, messageHistory, parentId, branchLabel, timestamp, version);
    }

    public String messageContent() {
        if (message == null) {
            return "";
        }
        Object content = message.get("content");
        return content == null ? "" : String.valueOf(content);
    }

    private static Map<String, Object> frozen(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
