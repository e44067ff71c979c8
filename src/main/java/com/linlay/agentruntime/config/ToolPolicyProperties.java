package com.linlay.agentruntime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tool filtering rules. An empty {@code globalAllow} means every tool not denied is allowed.
 */
@ConfigurationProperties(prefix = "agent.tool-policy")
public class ToolPolicyProperties {

    private Set<String> globalDeny = new LinkedHashSet<>();
    private Set<String> globalAllow = new LinkedHashSet<>();
    private Map<String, AgentPolicy> agents = new LinkedHashMap<>();

    public Set<String> getGlobalDeny() {
        return globalDeny;
    }

    public void setGlobalDeny(Set<String> globalDeny) {
        this.globalDeny = globalDeny == null ? new LinkedHashSet<>() : globalDeny;
    }

    public Set<String> getGlobalAllow() {
        return globalAllow;
    }

    public void setGlobalAllow(Set<String> globalAllow) {
        this.globalAllow = globalAllow == null ? new LinkedHashSet<>() : globalAllow;
    }

    public Map<String, AgentPolicy> getAgents() {
        return agents;
    }

    public void setAgents(Map<String, AgentPolicy> agents) {
        this.agents = agents == null ? new LinkedHashMap<>() : agents;
    }

    public static class AgentPolicy {
        private Set<String> allow = new LinkedHashSet<>();
        private Set<String> deny = new LinkedHashSet<>();

        public Set<String> getAllow() {
            return allow;
        }

        public void setAllow(Set<String> allow) {
            this.allow = allow == null ? new LinkedHashSet<>() : allow;
        }

        public Set<String> getDeny() {
            return deny;
        }

        public void setDeny(Set<String> deny) {
            this.deny = deny == null ? new LinkedHashSet<>() : deny;
        }
    }
}
