package com.linlay.agentruntime.agent.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A write action an agent wants the user to confirm before it runs.
 */
public record ApprovalRequest(
        String agentId,
        String agentName,
        String actionSummary,
        String riskLevel,
        Map<String, Object> details,
        List<String> options,
        int timeoutMinutes,
        boolean allowModification
) {

    public static final List<String> DEFAULT_OPTIONS = List.of("approve", "edit", "cancel");

    public ApprovalRequest {
        riskLevel = riskLevel == null || riskLevel.isBlank() ? "write" : riskLevel;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        options = options == null || options.isEmpty() ? DEFAULT_OPTIONS : List.copyOf(options);
    }
}
