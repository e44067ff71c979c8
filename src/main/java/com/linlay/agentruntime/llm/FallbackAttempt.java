package com.linlay.agentruntime.llm;

public record FallbackAttempt(
        String provider,
        String model,
        String error,
        FailoverReason reason,
        Integer statusCode
) {
}
