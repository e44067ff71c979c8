package com.linlay.agentruntime.agent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentReply;
import com.linlay.agentruntime.agent.AgentStatus;
import com.linlay.agentruntime.agent.AgentType;
import com.linlay.agentruntime.agent.AgentTypeRegistry;
import com.linlay.agentruntime.checkpoint.Checkpoint;
import com.linlay.agentruntime.checkpoint.CheckpointManager;
import com.linlay.agentruntime.llm.ToolSchema;
import com.linlay.agentruntime.pool.AgentPool;
import com.linlay.agentruntime.tool.BaseTool;
import com.linlay.agentruntime.tool.ToolContext;
import com.linlay.agentruntime.tool.ToolPolicyFilter;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Executes model tool calls. A call whose name is a registered agent type exposed as a tool is routed to an
 * agent from the pool; anything else goes to the {@link ToolRegistry}. Every failure comes back as a
 * {@link ToolOutcome} with error text for the model, never as an exception.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    static final String AGENT_COMPLETED = "Agent completed successfully.";
    static final String TASK_INSTRUCTION = "task_instruction";

    private final ToolRegistry toolRegistry;
    private final AgentTypeRegistry agentTypeRegistry;
    private final AgentPool agentPool;
    private final ToolPolicyFilter policyFilter;
    private final AuditLogger auditLogger;
    private final CheckpointManager checkpointManager;
    private final ObjectMapper objectMapper;
    private final ReactLoopConfig config;

    public ToolDispatcher(
            ToolRegistry toolRegistry,
            AgentTypeRegistry agentTypeRegistry,
            AgentPool agentPool,
            ToolPolicyFilter policyFilter,
            AuditLogger auditLogger,
            CheckpointManager checkpointManager,
            ObjectMapper objectMapper,
            ReactLoopConfig config
    ) {
        this.toolRegistry = toolRegistry;
        this.checkpointManager = checkpointManager;
        this.agentTypeRegistry = agentTypeRegistry;
        this.agentPool = agentPool;
        this.policyFilter = policyFilter == null ? new ToolPolicyFilter() : policyFilter;
        this.auditLogger = auditLogger;
        this.objectMapper = objectMapper;
        this.config = config == null ? ReactLoopConfig.DEFAULT : config;
    }

    /**
     * Runs all calls concurrently. Results come back in call order regardless of completion order.
     */
    public List<ToolOutcome> executeAll(List<AssistantMessage.ToolCall> calls, String tenantId) {
        return executeAll(calls, tenantId, List.of());
    }

    /**
     * Same as {@link #executeAll(List, String)}; agents driven by these calls are checkpointed with
     * {@code messageHistory} when checkpointing is on.
     */
    public List<ToolOutcome> executeAll(
            List<AssistantMessage.ToolCall> calls,
            String tenantId,
            List<Map<String, Object>> messageHistory
    ) {
        if (calls == null || calls.isEmpty()) {
            return List.of();
        }
        List<ToolOutcome> outcomes = Flux.fromIterable(calls)
                .flatMapSequential(call -> executeAsync(call, tenantId, messageHistory))
                .collectList()
                .block();
        return outcomes == null ? List.of() : outcomes;
    }

    public ToolOutcome execute(AssistantMessage.ToolCall call, String tenantId) {
        return executeAsync(call, tenantId, List.of()).block();
    }

    Mono<ToolOutcome> executeAsync(AssistantMessage.ToolCall call, String tenantId, List<Map<String, Object>> history) {
        String toolName = call.name() == null ? "" : call.name().trim();
        boolean agentTool = agentTypeRegistry.isAgentTool(toolName);
        Duration timeout = agentTool ? config.agentToolExecutionTimeout() : config.toolExecutionTimeout();
        long start = System.nanoTime();
        return Mono.fromCallable(() -> dispatch(call, toolName, agentTool, tenantId, history))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, ex -> Mono.just(ToolOutcome.failure(
                        call.id(),
                        toolName,
                        "[ERROR] Tool '" + toolName + "' timed out after " + formatDuration(timeout),
                        ToolOutcome.STATUS_TIMEOUT,
                        0
                )))
                .onErrorResume(ex -> Mono.just(ToolOutcome.failure(
                        call.id(),
                        toolName,
                        "[ERROR] " + errorMessage(ex),
                        ToolOutcome.STATUS_ERROR,
                        0
                )))
                .map(outcome -> outcome.withDuration((System.nanoTime() - start) / 1_000_000L))
                .doOnNext(outcome -> audit(tenantId, call, outcome));
    }

    private ToolOutcome dispatch(
            AssistantMessage.ToolCall call,
            String toolName,
            boolean agentTool,
            String tenantId,
            List<Map<String, Object>> history
    ) {
        Optional<String> denied = policyFilter.filterReason(toolName, null);
        if (denied.isPresent()) {
            log.info("[tool] rejected {}: {}", toolName, denied.get());
            return ToolOutcome.failure(call.id(), toolName, "Error: " + denied.get() + ".", ToolOutcome.STATUS_DENIED, 0);
        }
        Map<String, Object> args;
        try {
            args = parseArguments(call.arguments());
        } catch (IllegalArgumentException ex) {
            return ToolOutcome.failure(call.id(), toolName,
                    "[ERROR] Invalid arguments for tool '" + toolName + "': " + ex.getMessage(), ToolOutcome.STATUS_ERROR, 0);
        }
        if (agentTool) {
            return executeAgentTool(call, toolName, args, tenantId, history);
        }
        Optional<BaseTool> tool = toolRegistry.find(toolName);
        if (tool.isEmpty()) {
            if (agentTypeRegistry.find(toolName).isPresent()) {
                return ToolOutcome.failure(call.id(), toolName,
                        "Error: Agent type '" + toolName + "' is not exposed as a tool.", ToolOutcome.STATUS_ERROR, 0);
            }
            return ToolOutcome.failure(call.id(), toolName, "Error: Tool '" + toolName + "' not found.", ToolOutcome.STATUS_ERROR, 0);
        }
        try {
            JsonNode result = tool.get().invoke(args, new ToolContext(tenantId, call.id(), Map.of()));
            return ToolOutcome.success(call.id(), toolName, render(result), 0);
        } catch (RuntimeException ex) {
            log.warn("[tool] {} failed: {}", toolName, ex.getMessage());
            return ToolOutcome.failure(call.id(), toolName, "[ERROR] " + errorMessage(ex), ToolOutcome.STATUS_ERROR, 0);
        }
    }

    private ToolOutcome executeAgentTool(
            AssistantMessage.ToolCall call,
            String toolName,
            Map<String, Object> args,
            String tenantId,
            List<Map<String, Object>> history
    ) {
        AgentType type = agentTypeRegistry.find(toolName).orElse(null);
        if (type == null) {
            return ToolOutcome.failure(call.id(), toolName,
                    "Error: Agent type '" + toolName + "' not found.", ToolOutcome.STATUS_ERROR, 0);
        }
        Agent agent = findWaitingAgent(tenantId, type.name()).orElseGet(() -> {
            Map<String, Object> hints = new LinkedHashMap<>(args);
            hints.remove(TASK_INSTRUCTION);
            Agent created = agentTypeRegistry.create(type.name(), tenantId, hints);
            agentPool.add(created);
            return created;
        });
        Object rawInstruction = args.get(TASK_INSTRUCTION);
        String instruction = rawInstruction == null ? "" : String.valueOf(rawInstruction);
        AgentReply reply = agent.reply(instruction);
        log.debug("[tool] agent {} replied with status {}", agent.id(), reply.status());
        checkpoint(agent, instruction, reply, history);

        return switch (reply.status()) {
            case COMPLETED -> {
                agentPool.remove(tenantId, agent.id());
                String content = StringUtils.hasText(reply.rawMessage()) ? reply.rawMessage() : AGENT_COMPLETED;
                yield agentOutcome(call, toolName, agent, content, true, true, "completed", null);
            }
            case WAITING_FOR_INPUT -> {
                agentPool.update(agent);
                yield agentOutcome(call, toolName, agent, reply.rawMessage(), true, false, "waiting_for_input", null);
            }
            case WAITING_FOR_APPROVAL -> {
                agentPool.update(agent);
                ApprovalRequest approval = new ApprovalRequest(
                        agent.id(),
                        type.name(),
                        StringUtils.hasText(reply.rawMessage()) ? reply.rawMessage() : agent.approvalPrompt(),
                        "write",
                        reply.collectedFields(),
                        ApprovalRequest.DEFAULT_OPTIONS,
                        config.approvalTimeoutMinutes(),
                        true
                );
                yield agentOutcome(call, toolName, agent, reply.rawMessage(), true, false, "waiting_for_approval", approval);
            }
            case ERROR -> {
                agentPool.remove(tenantId, agent.id());
                String error = StringUtils.hasText(reply.errorMessage()) ? reply.errorMessage() : reply.rawMessage();
                yield agentOutcome(call, toolName, agent, "Error: " + error, false, true, "error", null);
            }
            case CANCELLED -> {
                agentPool.remove(tenantId, agent.id());
                String content = StringUtils.hasText(reply.rawMessage()) ? reply.rawMessage() : "Agent cancelled.";
                yield agentOutcome(call, toolName, agent, content, true, true, "cancelled", null);
            }
            default -> {
                agentPool.update(agent);
                yield agentOutcome(call, toolName, agent, reply.rawMessage(), true, true, reply.status().wireValue(), null);
            }
        };
    }

    private void checkpoint(Agent agent, String instruction, AgentReply reply, List<Map<String, Object>> history) {
        if (checkpointManager == null) {
            return;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "user");
        message.put("content", instruction);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", reply.status().wireValue());
        result.put("content", reply.rawMessage());
        try {
            Checkpoint saved = checkpointManager.saveCheckpoint(agent, message, result, history, null);
            agentPool.recordCheckpoint(agent.id(), saved.id());
        } catch (RuntimeException ex) {
            log.warn("[tool] checkpoint of agent {} failed: {}", agent.id(), ex.getMessage(), ex);
        }
    }

    private Optional<Agent> findWaitingAgent(String tenantId, String typeName) {
        return agentPool.list(tenantId).stream()
                .filter(agent -> agent.type().equalsIgnoreCase(typeName))
                .filter(agent -> agent.status() == AgentStatus.WAITING_FOR_INPUT || agent.status() == AgentStatus.WAITING_FOR_APPROVAL)
                .max(Comparator.comparing(Agent::lastActivity));
    }

    private ToolOutcome agentOutcome(
            AssistantMessage.ToolCall call,
            String toolName,
            Agent agent,
            String content,
            boolean success,
            boolean completed,
            String status,
            ApprovalRequest approval
    ) {
        return new ToolOutcome(call.id(), toolName, content, success, status, true, completed, agent.id(), approval, 0);
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (!StringUtils.hasText(arguments)) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(arguments, ARGS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(ex.getOriginalMessage(), ex);
        }
    }

    private String render(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return "";
        }
        if (result.isTextual()) {
            return result.asText();
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot render tool result", ex);
        }
    }

    private void audit(String tenantId, AssistantMessage.ToolCall call, ToolOutcome outcome) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.toolExecution(
                tenantId,
                outcome.toolName(),
                ToolCallRecord.summarize(call.arguments()),
                outcome.success(),
                outcome.durationMs(),
                outcome.content().length(),
                outcome.success() ? null : outcome.content()
        );
    }

    static String formatDuration(Duration duration) {
        if (duration.toMillis() % 1000 == 0) {
            return duration.toSeconds() + "s";
        }
        return duration.toMillis() + "ms";
    }

    private static String errorMessage(Throwable ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }

    /**
     * Schemas of every plain tool and every agent type exposed as a tool, after policy filtering.
     */
    public List<ToolSchema> availableToolSchemas() {
        List<ToolSchema> schemas = new ArrayList<>();
        for (BaseTool tool : toolRegistry.list()) {
            schemas.add(new ToolSchema(tool.name(), tool.description(), tool.parametersSchema()));
        }
        for (AgentType type : agentTypeRegistry.agentTools()) {
            schemas.add(new ToolSchema(type.name(), type.description(), type.toolParametersSchema()));
        }
        return policyFilter.filterTools(schemas, null);
    }
}
