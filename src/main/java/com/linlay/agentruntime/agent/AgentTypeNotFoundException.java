package com.linlay.agentruntime.agent;

public class AgentTypeNotFoundException extends RuntimeException {

    public AgentTypeNotFoundException(String agentType) {
        super("Agent type '" + agentType + "' not found.");
    }
}
