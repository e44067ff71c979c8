package com.linlay.agentruntime.tool;

import java.util.Map;

/**
 * Per-call information handed to a tool.
 */
public record ToolContext(
        String tenantId,
        String callId,
        Map<String, Object> metadata
) {

    public ToolContext {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ToolContext of(String tenantId, String callId) {
        return new ToolContext(tenantId, callId, Map.of());
    }
}
