package com.linlay.agentruntime.service;

import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentReply;
import com.linlay.agentruntime.agent.AgentStatus;
import com.linlay.agentruntime.agent.runtime.ApprovalRequest;
import com.linlay.agentruntime.agent.runtime.AuditLogger;
import com.linlay.agentruntime.agent.runtime.ReactEngine;
import com.linlay.agentruntime.agent.runtime.ReactLoopResult;
import com.linlay.agentruntime.agent.runtime.ToolDispatcher;
import com.linlay.agentruntime.checkpoint.Checkpoint;
import com.linlay.agentruntime.checkpoint.CheckpointManager;
import com.linlay.agentruntime.pool.AgentPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for user messages. A message goes to the tenant's waiting agent when there is one, otherwise
 * to the ReAct loop with every registered tool and agent-tool on offer.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private static final Set<AgentStatus> PAUSABLE = EnumSet.of(
            AgentStatus.RUNNING,
            AgentStatus.WAITING_FOR_INPUT,
            AgentStatus.WAITING_FOR_APPROVAL,
            AgentStatus.INITIALIZING
    );

    private final ReactEngine reactEngine;
    private final ToolDispatcher toolDispatcher;
    private final AgentPool agentPool;
    private final CheckpointManager checkpointManager;
    private final AuditLogger auditLogger;
    private final String systemPrompt;
    private final boolean lazyRestore;
    private final Set<String> restoredTenants = ConcurrentHashMap.newKeySet();

    public Orchestrator(
            ReactEngine reactEngine,
            ToolDispatcher toolDispatcher,
            AgentPool agentPool,
            CheckpointManager checkpointManager,
            AuditLogger auditLogger,
            String systemPrompt,
            boolean lazyRestore
    ) {
        this.reactEngine = reactEngine;
        this.toolDispatcher = toolDispatcher;
        this.agentPool = agentPool;
        this.checkpointManager = checkpointManager;
        this.auditLogger = auditLogger;
        this.systemPrompt = systemPrompt;
        this.lazyRestore = lazyRestore;
    }

    public OrchestratorReply handleMessage(String tenantId, String message) {
        if (!StringUtils.hasText(tenantId)) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        String text = message == null ? "" : message;
        restoreIfNeeded(tenantId);

        Optional<Agent> waiting = agentPool.getWaitingAgent(tenantId);
        if (waiting.isPresent()) {
            Agent agent = waiting.get();
            audit(tenantId, agent.id(), "waiting_agent");
            boolean approvalPending = agent.status() == AgentStatus.WAITING_FOR_APPROVAL;
            AgentReply reply = agent.reply(text);
            if (approvalPending && auditLogger != null) {
                auditLogger.approvalDecision(tenantId, agent.id(), reply.status().wireValue());
            }
            checkpoint(agent, text, reply);
            updatePoolAfterExecution(tenantId, agent);
            log.debug("[orchestrator] tenant={} routed to {} -> {}", tenantId, agent.id(), reply.status());
            return OrchestratorReply.fromAgent(tenantId, reply, pendingApprovals(tenantId));
        }

        audit(tenantId, null, "react_loop");
        List<Message> messages = new ArrayList<>();
        if (StringUtils.hasText(systemPrompt)) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(text));
        ReactLoopResult result = reactEngine.run(messages, toolDispatcher.availableToolSchemas(), tenantId);
        log.info("[orchestrator] tenant={} loop finished turns={} toolCalls={} durationMs={}",
                tenantId, result.turns(), result.toolCalls().size(), result.durationMs());
        return OrchestratorReply.fromLoop(tenantId, result);
    }

    public List<AgentSummary> listAgents(String tenantId) {
        restoreIfNeeded(tenantId);
        return agentPool.list(tenantId).stream().map(AgentSummary::of).toList();
    }

    public Optional<AgentSummary> getAgentStatus(String tenantId, String agentId) {
        restoreIfNeeded(tenantId);
        return agentPool.get(tenantId, agentId).map(AgentSummary::of);
    }

    public boolean cancelAgent(String tenantId, String agentId) {
        Optional<Agent> agent = agentPool.get(tenantId, agentId);
        if (agent.isEmpty()) {
            return false;
        }
        if (agent.get().status().canTransitionTo(AgentStatus.CANCELLED)) {
            agent.get().transitionTo(AgentStatus.CANCELLED);
        }
        agentPool.remove(tenantId, agentId);
        log.info("[orchestrator] tenant={} cancelled {}", tenantId, agentId);
        return true;
    }

    public Optional<AgentReply> pauseAgent(String tenantId, String agentId) {
        Optional<Agent> found = agentPool.get(tenantId, agentId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Agent agent = found.get();
        if (!PAUSABLE.contains(agent.status())) {
            log.warn("[orchestrator] cannot pause {} in status {}", agentId, agent.status());
            return Optional.empty();
        }
        AgentReply reply = agent.pause();
        agentPool.update(agent);
        return Optional.of(reply);
    }

    public Optional<AgentReply> resumeAgent(String tenantId, String agentId, String message) {
        Optional<Agent> found = agentPool.get(tenantId, agentId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Agent agent = found.get();
        if (agent.status() != AgentStatus.PAUSED) {
            log.warn("[orchestrator] cannot resume {}: not paused (status {})", agentId, agent.status());
            return Optional.empty();
        }
        AgentReply reply = agent.resume(message);
        if (StringUtils.hasText(message)) {
            checkpoint(agent, message, reply);
        }
        updatePoolAfterExecution(tenantId, agent);
        return Optional.of(reply);
    }

    /**
     * Approval requests of every agent of the tenant currently waiting for approval.
     */
    public List<ApprovalRequest> pendingApprovals(String tenantId) {
        List<ApprovalRequest> pending = new ArrayList<>();
        for (Agent agent : agentPool.list(tenantId)) {
            if (agent.status() != AgentStatus.WAITING_FOR_APPROVAL) {
                continue;
            }
            pending.add(new ApprovalRequest(
                    agent.id(),
                    agent.type(),
                    agent.approvalPrompt(),
                    "write",
                    agent.collectedFields(),
                    ApprovalRequest.DEFAULT_OPTIONS,
                    reactEngine.config().approvalTimeoutMinutes(),
                    true
            ));
        }
        return pending;
    }

    private void updatePoolAfterExecution(String tenantId, Agent agent) {
        if (agent.status().isTerminal()) {
            agentPool.remove(tenantId, agent.id());
        } else {
            agentPool.update(agent);
        }
    }

    private void restoreIfNeeded(String tenantId) {
        if (!lazyRestore || agentPool.hasAgentsInMemory(tenantId) || !restoredTenants.add(tenantId)) {
            return;
        }
        try {
            agentPool.restoreTenantSession(tenantId);
        } catch (RuntimeException ex) {
            restoredTenants.remove(tenantId);
            log.error("[orchestrator] failed to restore session of tenant {}: {}", tenantId, ex.getMessage(), ex);
        }
    }

    private void checkpoint(Agent agent, String message, AgentReply reply) {
        if (checkpointManager == null) {
            return;
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("role", "user");
        input.put("content", message);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", reply.status().wireValue());
        output.put("content", reply.rawMessage());
        try {
            Checkpoint saved = checkpointManager.saveCheckpoint(agent, input, output, null, null);
            agentPool.recordCheckpoint(agent.id(), saved.id());
        } catch (RuntimeException ex) {
            log.warn("[orchestrator] checkpoint of {} failed: {}", agent.id(), ex.getMessage(), ex);
        }
    }

    private void audit(String tenantId, String targetAgentId, String reason) {
        if (auditLogger == null) {
            return;
        }
        int waiting = (int) agentPool.list(tenantId).stream().filter(agent -> agent.status().isWaiting()).count();
        auditLogger.routeDecision(tenantId, targetAgentId, waiting, reason);
    }
}
