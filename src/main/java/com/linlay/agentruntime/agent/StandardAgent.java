package com.linlay.agentruntime.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Base class for stateful agents. Owns the status state machine and the pause/resume bookkeeping;
 * subclasses implement the conversation itself in {@link #onMessage(String)}.
 */
public abstract class StandardAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(StandardAgent.class);

    private static final Set<String> APPROVE_WORDS = Set.of("yes", "y", "approve", "approved", "ok", "okay", "confirm", "go ahead");
    private static final Set<String> REJECT_WORDS = Set.of("no", "n", "cancel", "reject", "stop", "abort");

    private final String type;
    private final String tenantId;
    private final Clock clock;
    private final Instant createdAt;

    private String id;
    private AgentStatus status = AgentStatus.INITIALIZING;
    private AgentStatus statusBeforePause;
    private Instant lastActivity;
    private final Map<String, Object> collectedFields = new LinkedHashMap<>();
    private final Map<String, Object> executionState = new LinkedHashMap<>();
    private final Map<String, Object> context = new LinkedHashMap<>();

    protected StandardAgent(String type, String tenantId, Map<String, Object> contextHints) {
        this(type, tenantId, contextHints, Clock.systemUTC());
    }

    protected StandardAgent(String type, String tenantId, Map<String, Object> contextHints, Clock clock) {
        if (!StringUtils.hasText(type)) {
            throw new IllegalArgumentException("agent type must not be blank");
        }
        if (!StringUtils.hasText(tenantId)) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        this.type = type.trim();
        this.tenantId = tenantId.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.createdAt = this.clock.instant();
        this.lastActivity = createdAt;
        this.id = this.type + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        if (contextHints != null) {
            context.putAll(contextHints);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public synchronized AgentStatus status() {
        return status;
    }

    @Override
    public synchronized Map<String, Object> collectedFields() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(collectedFields));
    }

    @Override
    public synchronized Map<String, Object> executionState() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(executionState));
    }

    @Override
    public synchronized Map<String, Object> context() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    @Override
    public synchronized AgentReply reply(String message) {
        touch();
        if (status.isTerminal()) {
            return AgentReply.of(this, "");
        }
        if (status == AgentStatus.PAUSED) {
            return AgentReply.of(this, pausedMessage());
        }
        try {
            if (status == AgentStatus.WAITING_FOR_APPROVAL) {
                return handleApprovalResponse(message);
            }
            if (status != AgentStatus.RUNNING) {
                transitionTo(AgentStatus.RUNNING);
            }
            return onMessage(message == null ? "" : message);
        } catch (RuntimeException ex) {
            log.warn("[agent] {} failed while handling message: {}", id, ex.getMessage(), ex);
            status = AgentStatus.ERROR;
            return AgentReply.error(this, ex.getMessage());
        }
    }

    @Override
    public synchronized AgentReply pause() {
        touch();
        if (status == AgentStatus.PAUSED) {
            return AgentReply.of(this, pausedMessage());
        }
        statusBeforePause = status;
        transitionTo(AgentStatus.PAUSED);
        return AgentReply.of(this, pausedMessage());
    }

    @Override
    public synchronized AgentReply resume(String message) {
        touch();
        if (status != AgentStatus.PAUSED) {
            return AgentReply.of(this, "");
        }
        AgentStatus previous = statusBeforePause == null ? AgentStatus.WAITING_FOR_INPUT : statusBeforePause;
        statusBeforePause = null;
        transitionTo(previous);
        if (StringUtils.hasText(message)) {
            return reply(message);
        }
        return switch (previous) {
            case WAITING_FOR_APPROVAL -> AgentReply.of(this, approvalPrompt());
            case WAITING_FOR_INPUT -> AgentReply.of(this, nextPrompt());
            default -> AgentReply.of(this, "");
        };
    }

    @Override
    public synchronized void transitionTo(AgentStatus target) {
        if (target == null) {
            throw new IllegalArgumentException("target status must not be null");
        }
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal status transition for " + id + ": " + status + " -> " + target);
        }
        log.debug("[agent] {} {} -> {}", id, status, target);
        status = target;
    }

    @Override
    public synchronized void restoreState(
            String agentId,
            AgentStatus restoredStatus,
            Map<String, Object> restoredFields,
            Map<String, Object> restoredExecutionState,
            Map<String, Object> restoredContext
    ) {
        if (StringUtils.hasText(agentId)) {
            this.id = agentId.trim();
        }
        if (restoredStatus != null) {
            this.status = restoredStatus;
        }
        replace(collectedFields, restoredFields);
        replace(executionState, restoredExecutionState);
        replace(context, restoredContext);
    }

    protected abstract AgentReply onMessage(String message);

    /**
     * Called once the user approved the pending action. Default completes the agent.
     */
    protected AgentReply onApproved() {
        return complete("Done.");
    }

    /**
     * Called when the user neither approved nor rejected. Default treats the text as a modification.
     */
    protected AgentReply onApprovalModification(String message) {
        transitionTo(AgentStatus.RUNNING);
        return onMessage(message);
    }

    protected String nextPrompt() {
        return "";
    }

    protected String pausedMessage() {
        return "Task paused.";
    }

    protected final AgentReply waitForInput(String prompt) {
        transitionTo(AgentStatus.WAITING_FOR_INPUT);
        return AgentReply.of(this, prompt);
    }

    protected final AgentReply waitForApproval(String prompt) {
        transitionTo(AgentStatus.WAITING_FOR_APPROVAL);
        return AgentReply.of(this, prompt);
    }

    protected final AgentReply complete(String message) {
        transitionTo(AgentStatus.COMPLETED);
        return AgentReply.of(this, message);
    }

    protected final synchronized void collect(String field, Object value) {
        collectedFields.put(field, value);
    }

    protected final synchronized Object collected(String field) {
        return collectedFields.get(field);
    }

    protected final synchronized void putExecutionState(String key, Object value) {
        executionState.put(key, value);
    }

    private AgentReply handleApprovalResponse(String message) {
        String normalized = message == null ? "" : message.trim().toLowerCase(Locale.ROOT);
        if (APPROVE_WORDS.contains(normalized)) {
            transitionTo(AgentStatus.RUNNING);
            return onApproved();
        }
        if (REJECT_WORDS.contains(normalized)) {
            transitionTo(AgentStatus.CANCELLED);
            return AgentReply.of(this, "Cancelled.");
        }
        return onApprovalModification(message);
    }

    private void touch() {
        lastActivity = clock.instant();
    }

    private static void replace(Map<String, Object> target, Map<String, Object> source) {
        target.clear();
        if (source != null) {
            target.putAll(source);
        }
    }
}
