package com.linlay.agentruntime.agent;

import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registration record for an agent type. {@code exposeAsTool} makes the type callable from the ReAct loop.
 */
public record AgentType(
        String name,
        String description,
        List<FieldSpec> fields,
        AgentFactory factory,
        boolean exposeAsTool
) {

    public AgentType {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("agent type name must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("agent factory must not be null for " + name);
        }
        name = name.trim();
        description = StringUtils.hasText(description) ? description.trim() : name;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public int schemaVersion() {
        return SchemaVersions.of(fields);
    }

    /**
     * JSON schema used when the type is offered to the model as a tool.
     */
    public Map<String, Object> toolParametersSchema() {
        Map<String, Object> instruction = new LinkedHashMap<>();
        instruction.put("type", "string");
        instruction.put("description", "What this agent should do, in the user's words");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("task_instruction", instruction);
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("task_instruction"));
        return schema;
    }
}
