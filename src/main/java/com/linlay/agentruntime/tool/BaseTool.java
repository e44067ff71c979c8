package com.linlay.agentruntime.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * Runs the tool. Text results are returned as a {@code TextNode}; anything else is rendered as JSON.
     * Implementations may throw; the dispatcher turns exceptions into error results for the model.
     */
    JsonNode invoke(Map<String, Object> args, ToolContext context);
}
