package com.linlay.agentruntime.checkpoint;

import com.linlay.agentruntime.agent.AgentStatus;

import java.time.Instant;

/**
 * Lightweight view of a checkpoint used for listings and trees.
 */
public record CheckpointMetadata(
        String id,
        String agentId,
        String agentType,
        String tenantId,
        AgentStatus status,
        String parentCheckpointId,
        String branchLabel,
        Instant timestamp,
        int fieldsCount,
        String messagePreview
) {

    static final int PREVIEW_CHARS = 100;

    public static CheckpointMetadata from(Checkpoint checkpoint) {
        String content = checkpoint.messageContent();
        String preview = content.length() > PREVIEW_CHARS ? content.substring(0, PREVIEW_CHARS) : content;
        return new CheckpointMetadata(
                checkpoint.id(),
                checkpoint.agentId(),
                checkpoint.agentType(),
                checkpoint.tenantId(),
                checkpoint.status(),
                checkpoint.parentCheckpointId(),
                checkpoint.branchLabel(),
                checkpoint.timestamp(),
                checkpoint.collectedFields().size(),
                preview
        );
    }
}
