package com.linlay.agentruntime.llm;

import java.util.List;

public record RoutingRule(
        int minScore,
        int maxScore,
        String provider
) {

    public static final List<RoutingRule> DEFAULTS = List.of(
            new RoutingRule(1, 30, "cheap"),
            new RoutingRule(31, 70, "fast"),
            new RoutingRule(71, 100, "strong")
    );

    public RoutingRule {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("routing rule provider must not be blank");
        }
        if (maxScore < minScore) {
            throw new IllegalArgumentException("routing rule maxScore < minScore: " + minScore + ".." + maxScore);
        }
        provider = provider.trim();
    }

    public boolean matches(int score) {
        return score >= minScore && score <= maxScore;
    }
}
