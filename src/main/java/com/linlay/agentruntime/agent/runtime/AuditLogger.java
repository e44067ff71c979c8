package com.linlay.agentruntime.agent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON line per orchestration decision on the {@code agent.audit} logger, so the stream can be routed
 * to its own appender.
 */
public class AuditLogger {

    public static final String LOGGER_NAME = "agent.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLogger(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public AuditLogger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void toolExecution(String tenantId, String toolName, String argsSummary, boolean success,
                              long durationMs, int resultChars, String error) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tenant_id", nullToEmpty(tenantId));
        fields.put("tool_name", toolName);
        fields.put("args_summary", argsSummary);
        fields.put("success", success);
        fields.put("duration_ms", durationMs);
        fields.put("result_chars", resultChars);
        if (error != null) {
            fields.put("error", error);
        }
        emit("tool_execution", fields);
    }

    public void routeDecision(String tenantId, String targetAgentId, int waitingAgents, String reason) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tenant_id", nullToEmpty(tenantId));
        fields.put("target_agent_id", targetAgentId);
        fields.put("waiting_agents_count", waitingAgents);
        fields.put("reason", reason);
        emit("route_decision", fields);
    }

    public void approvalDecision(String tenantId, String agentId, String decision) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tenant_id", nullToEmpty(tenantId));
        fields.put("agent_id", agentId);
        fields.put("decision", decision);
        emit("approval_decision", fields);
    }

    private void emit(String eventType, Map<String, Object> fields) {
        if (!audit.isInfoEnabled()) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", clock.instant().toString());
        entry.put("event_type", eventType);
        entry.putAll(fields);
        try {
            audit.info(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException ex) {
            log.warn("[audit] cannot serialize {} entry: {}", eventType, ex.getOriginalMessage());
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
