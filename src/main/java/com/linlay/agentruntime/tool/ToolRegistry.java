package com.linlay.agentruntime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Object registerLock = new Object();
    private volatile Map<String, BaseTool> toolsByName = Map.of();

    public ToolRegistry(List<BaseTool> tools) {
        if (tools != null) {
            tools.forEach(this::register);
        }
    }

    @Autowired
    public ToolRegistry(ObjectProvider<BaseTool> toolProvider) {
        this(toolProvider.orderedStream().toList());
    }

    public void register(BaseTool tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        String name = normalizeName(tool.name());
        if (name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        synchronized (registerLock) {
            Map<String, BaseTool> updated = new LinkedHashMap<>(toolsByName);
            if (updated.putIfAbsent(name, tool) != null) {
                log.warn("[tool] duplicate tool name '{}', keeping the first registration", name);
                return;
            }
            toolsByName = Map.copyOf(updated);
        }
    }

    public Optional<BaseTool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    public JsonNode invoke(String toolName, Map<String, Object> args, ToolContext context) {
        BaseTool tool = toolsByName.get(normalizeName(toolName));
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
        return tool.invoke(args == null ? Map.of() : args, context);
    }

    public List<BaseTool> list() {
        return toolsByName.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
    }

    private String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
