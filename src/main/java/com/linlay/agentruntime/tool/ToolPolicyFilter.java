package com.linlay.agentruntime.tool;

import com.linlay.agentruntime.config.ToolPolicyProperties;
import com.linlay.agentruntime.llm.ToolSchema;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Global and per-agent-type tool allow/deny lists.
 * Evaluation order: global deny, global allow, agent deny, agent allow.
 */
public class ToolPolicyFilter {

    private final Object updateLock = new Object();
    private volatile Set<String> globalDeny = Set.of();
    private volatile Set<String> globalAllow;
    private volatile Map<String, AgentToolPolicy> agentPolicies = Map.of();

    public ToolPolicyFilter() {
    }

    public ToolPolicyFilter(ToolPolicyProperties properties) {
        if (properties == null) {
            return;
        }
        setGlobalDeny(properties.getGlobalDeny());
        if (!properties.getGlobalAllow().isEmpty()) {
            setGlobalAllow(properties.getGlobalAllow());
        }
        properties.getAgents().forEach((agentType, policy) -> setAgentPolicy(
                agentType,
                policy.getAllow().isEmpty() ? null : policy.getAllow(),
                policy.getDeny()
        ));
    }

    public void setGlobalDeny(Set<String> toolNames) {
        globalDeny = normalize(toolNames);
    }

    /**
     * Restricts every agent to {@code toolNames}; {@code null} lifts the restriction.
     */
    public void setGlobalAllow(Set<String> toolNames) {
        globalAllow = toolNames == null ? null : normalize(toolNames);
    }

    public void setAgentPolicy(String agentType, Set<String> allow, Set<String> deny) {
        if (!StringUtils.hasText(agentType)) {
            throw new IllegalArgumentException("agentType must not be blank");
        }
        synchronized (updateLock) {
            Map<String, AgentToolPolicy> updated = new LinkedHashMap<>(agentPolicies);
            updated.put(key(agentType), new AgentToolPolicy(allow == null ? null : normalize(allow), normalize(deny)));
            agentPolicies = Map.copyOf(updated);
        }
    }

    public boolean isAllowed(String toolName, String agentType) {
        return filterReason(toolName, agentType).isEmpty();
    }

    public List<ToolSchema> filterTools(List<ToolSchema> schemas, String agentType) {
        if (schemas == null || schemas.isEmpty()) {
            return List.of();
        }
        return schemas.stream()
                .filter(schema -> isAllowed(schema.name(), agentType))
                .toList();
    }

    /**
     * Human-readable reason the tool is blocked, empty when it is allowed.
     */
    public Optional<String> filterReason(String toolName, String agentType) {
        String tool = key(toolName);
        if (globalDeny.contains(tool)) {
            return Optional.of("tool '" + toolName + "' is in the global deny list");
        }
        Set<String> allow = globalAllow;
        if (allow != null && !allow.contains(tool)) {
            return Optional.of("tool '" + toolName + "' is not in the global allow list");
        }
        if (StringUtils.hasText(agentType)) {
            AgentToolPolicy policy = agentPolicies.get(key(agentType));
            if (policy != null) {
                if (policy.deny().contains(tool)) {
                    return Optional.of("tool '" + toolName + "' is denied for agent '" + agentType + "'");
                }
                if (policy.allow() != null && !policy.allow().contains(tool)) {
                    return Optional.of("tool '" + toolName + "' is not in the allow list for agent '" + agentType + "'");
                }
            }
        }
        return Optional.empty();
    }

    private static Set<String> normalize(Set<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        return names.stream()
                .filter(StringUtils::hasText)
                .map(ToolPolicyFilter::key)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private record AgentToolPolicy(Set<String> allow, Set<String> deny) {
    }
}
