package com.linlay.agentruntime.llm;

public record RoutingDecision(
        String provider,
        int score,
        String reasoning,
        long latencyMs
) {
}
