package com.linlay.agentruntime.llm;

import java.time.Duration;

public record CooldownPolicy(
        Duration base,
        double multiplier,
        Duration max
) {

    public static final CooldownPolicy DEFAULT = new CooldownPolicy(Duration.ofSeconds(60), 5.0, Duration.ofSeconds(3600));

    public CooldownPolicy {
        base = base == null || base.isNegative() ? Duration.ofSeconds(60) : base;
        multiplier = multiplier >= 1.0 ? multiplier : 5.0;
        max = max == null || max.compareTo(base) < 0 ? Duration.ofSeconds(3600) : max;
    }

    public Duration cooldownFor(int errorCount) {
        double millis = base.toMillis() * Math.pow(multiplier, Math.max(0, errorCount));
        long capped = (long) Math.min(millis, (double) max.toMillis());
        return Duration.ofMillis(capped);
    }
}
