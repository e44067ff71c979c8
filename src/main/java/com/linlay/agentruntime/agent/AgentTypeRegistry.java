package com.linlay.agentruntime.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class AgentTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentTypeRegistry.class);

    private final Object registerLock = new Object();
    private volatile Map<String, AgentType> types = Map.of();

    public AgentTypeRegistry(List<AgentType> initialTypes) {
        if (initialTypes != null) {
            initialTypes.forEach(this::register);
        }
    }

    @Autowired
    public AgentTypeRegistry(ObjectProvider<AgentType> typeProvider) {
        this(typeProvider.orderedStream().toList());
    }

    public void register(AgentType type) {
        synchronized (registerLock) {
            Map<String, AgentType> updated = new LinkedHashMap<>(types);
            AgentType previous = updated.put(normalizeName(type.name()), type);
            if (previous != null) {
                log.warn("[agent] type '{}' registered twice, keeping the latest", type.name());
            }
            types = Map.copyOf(updated);
            log.debug("[agent] registered type '{}' schemaVersion={}", type.name(), type.schemaVersion());
        }
    }

    public Optional<AgentType> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(normalizeName(name)));
    }

    public AgentType get(String name) {
        return find(name).orElseThrow(() -> new AgentTypeNotFoundException(name));
    }

    public boolean isAgentTool(String name) {
        return find(name).map(AgentType::exposeAsTool).orElse(false);
    }

    public List<AgentType> list() {
        return types.values().stream()
                .sorted(Comparator.comparing(AgentType::name))
                .toList();
    }

    public List<AgentType> agentTools() {
        return list().stream().filter(AgentType::exposeAsTool).toList();
    }

    public int schemaVersion(String name) {
        return find(name).map(AgentType::schemaVersion).orElse(0);
    }

    public Agent create(String name, String tenantId, Map<String, Object> contextHints) {
        AgentType type = get(name);
        Agent agent = type.factory().create(tenantId, contextHints == null ? Map.of() : contextHints);
        if (agent == null) {
            throw new IllegalStateException("Agent factory for '" + type.name() + "' returned null");
        }
        return agent;
    }

    private String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
