package com.linlay.agentruntime.agent;

import java.util.Map;

@FunctionalInterface
public interface AgentFactory {

    Agent create(String tenantId, Map<String, Object> contextHints);
}
