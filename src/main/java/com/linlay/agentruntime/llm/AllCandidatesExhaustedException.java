package com.linlay.agentruntime.llm;

import java.util.List;
import java.util.stream.Collectors;

public class AllCandidatesExhaustedException extends RuntimeException {

    private final List<FallbackAttempt> attempts;

    public AllCandidatesExhaustedException(List<FallbackAttempt> attempts) {
        super("All model candidates exhausted: " + summarize(attempts));
        this.attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public List<FallbackAttempt> attempts() {
        return attempts;
    }

    private static String summarize(List<FallbackAttempt> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return "no candidates configured";
        }
        return attempts.stream()
                .map(attempt -> attempt.provider() + "/" + attempt.model() + "=" + attempt.reason().wireValue())
                .collect(Collectors.joining(", "));
    }
}
