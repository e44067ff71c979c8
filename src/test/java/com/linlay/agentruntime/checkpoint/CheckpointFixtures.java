package com.linlay.agentruntime.checkpoint;

import com.linlay.agentruntime.agent.AgentStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class CheckpointFixtures {

    static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private CheckpointFixtures() {
    }

    static Checkpoint checkpoint(String id, String agentId, String parentId, AgentStatus status,
                                 Map<String, Object> fields, long secondsAfterT0) {
        return checkpoint(id, agentId, "tenant-a", parentId, status, fields, secondsAfterT0);
    }

    static Checkpoint checkpoint(String id, String agentId, String tenantId, String parentId, AgentStatus status,
                                 Map<String, Object> fields, long secondsAfterT0) {
        return new Checkpoint(
                id,
                agentId,
                "booking",
                tenantId,
                status,
                fields,
                Map.of("step", "s" + secondsAfterT0),
                Map.of(),
                Map.of("role", "user", "content", "message for " + id),
                Map.of("status", status.wireValue()),
                List.of(Map.of("role", "user", "content", "hello")),
                parentId,
                null,
                T0.plusSeconds(secondsAfterT0),
                Checkpoint.CURRENT_VERSION
        );
    }
}
