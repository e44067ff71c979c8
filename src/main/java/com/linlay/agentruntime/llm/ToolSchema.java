package com.linlay.agentruntime.llm;

import org.springframework.util.StringUtils;

import java.util.Map;

public record ToolSchema(
        String name,
        String description,
        Map<String, Object> parameters
) {

    public ToolSchema {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("tool schema name must not be blank");
        }
        name = name.trim();
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of("type", "object", "properties", Map.of()) : parameters;
    }
}
