package com.linlay.agentruntime.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.agent.AgentReply;
import com.linlay.agentruntime.agent.AgentStatus;
import com.linlay.agentruntime.agent.AgentTypeRegistry;
import com.linlay.agentruntime.agent.TestAgents;
import com.linlay.agentruntime.agent.runtime.ApprovalRequest;
import com.linlay.agentruntime.agent.runtime.AuditLogger;
import com.linlay.agentruntime.agent.runtime.ReactEngine;
import com.linlay.agentruntime.agent.runtime.ReactLoopConfig;
import com.linlay.agentruntime.agent.runtime.ToolDispatcher;
import com.linlay.agentruntime.checkpoint.CheckpointManager;
import com.linlay.agentruntime.checkpoint.CheckpointMetadata;
import com.linlay.agentruntime.checkpoint.InMemoryCheckpointStorage;
import com.linlay.agentruntime.llm.ChatCompletion;
import com.linlay.agentruntime.llm.ToolSchema;
import com.linlay.agentruntime.memory.ContextManager;
import com.linlay.agentruntime.pool.AgentPool;
import com.linlay.agentruntime.pool.InMemoryPoolBackend;
import com.linlay.agentruntime.pool.PoolBackend;
import com.linlay.agentruntime.support.ScriptedLlmClient;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class OrchestratorTest {

    private static final String TENANT = "tenant-1";
    private static final String SYSTEM_PROMPT = "You help with travel.";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();
    private final AgentTypeRegistry types = TestAgents.registry(clock);
    private final List<AgentPool> pools = new ArrayList<>();
    private PoolBackend backend;
    private CheckpointManager checkpointManager;
    private AuditLogger auditLogger;
    private ScriptedLlmClient llm;

    @BeforeEach
    void setUp() {
        backend = new InMemoryPoolBackend();
        checkpointManager = new CheckpointManager(new InMemoryCheckpointStorage(), clock);
        auditLogger = mock(AuditLogger.class);
        llm = new ScriptedLlmClient();
    }

    @AfterEach
    void tearDown() {
        pools.forEach(AgentPool::close);
    }

    @Test
    void blankTenantShouldBeRejected() {
        Orchestrator orchestrator = orchestrator(false);

        assertThatThrownBy(() -> orchestrator.handleMessage(" ", "hi"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void messageWithoutWaitingAgentShouldRunTheLoop() {
        llm.then(ChatCompletion.text("Hi there!"));
        Orchestrator orchestrator = orchestrator(false);

        OrchestratorReply reply = orchestrator.handleMessage(TENANT, "hello");

        assertThat(reply.routedToAgent()).isFalse();
        assertThat(reply.response()).isEqualTo("Hi there!");
        assertThat(reply.loopResult().turns()).isEqualTo(1);
        assertThat(llm.calls().get(0).get(0)).isInstanceOfSatisfying(SystemMessage.class,
                system -> assertThat(system.getText()).isEqualTo(SYSTEM_PROMPT));
        assertThat(llm.tools().get(0)).extracting(ToolSchema::name).contains(TestAgents.BOOKING, TestAgents.ECHO);
        verify(auditLogger).routeDecision(eq(TENANT), isNull(), eq(0), eq("react_loop"));
    }

    @Test
    void followUpMessagesShouldGoToTheWaitingAgentUntilItCompletes() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);

        OrchestratorReply dateReply = orchestrator.handleMessage(TENANT, "2026-05-01");

        assertThat(dateReply.routedToAgent()).isTrue();
        assertThat(dateReply.agentReply().status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
        assertThat(dateReply.response()).isEqualTo("Book Paris on 2026-05-01?");
        assertThat(dateReply.pendingApprovals()).singleElement().satisfies(approval -> {
            assertThat(approval.agentId()).isEqualTo(agentId);
            assertThat(approval.actionSummary()).isEqualTo("Book Paris on 2026-05-01?");
            assertThat(approval.timeoutMinutes()).isEqualTo(ReactLoopConfig.DEFAULT.approvalTimeoutMinutes());
        });
        verify(auditLogger).routeDecision(TENANT, agentId, 1, "waiting_agent");

        OrchestratorReply approved = orchestrator.handleMessage(TENANT, "yes");

        assertThat(approved.response()).isEqualTo("Booked Paris on 2026-05-01.");
        assertThat(approved.agentReply().isCompleted()).isTrue();
        assertThat(approved.pendingApprovals()).isEmpty();
        assertThat(orchestrator.listAgents(TENANT)).isEmpty();
        verify(auditLogger).approvalDecision(TENANT, agentId, "completed");
        assertThat(llm.calls()).hasSize(1);
    }

    @Test
    void everyAgentTurnShouldExtendTheCheckpointChain() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);
        orchestrator.handleMessage(TENANT, "2026-05-01");
        orchestrator.handleMessage(TENANT, "yes");

        List<CheckpointMetadata> history = checkpointManager.history(agentId, 10, 0);

        assertThat(history).hasSize(3);
        assertThat(history).extracting(CheckpointMetadata::status).containsExactly(
                AgentStatus.COMPLETED, AgentStatus.WAITING_FOR_APPROVAL, AgentStatus.WAITING_FOR_INPUT);
        assertThat(history.get(0).parentCheckpointId()).isEqualTo(history.get(1).id());
        assertThat(history.get(1).parentCheckpointId()).isEqualTo(history.get(2).id());
        assertThat(history.get(2).parentCheckpointId()).isNull();
    }

    @Test
    void agentsShouldBeListedAndInspectable() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);

        assertThat(orchestrator.listAgents(TENANT)).singleElement().satisfies(summary -> {
            assertThat(summary.agentId()).isEqualTo(agentId);
            assertThat(summary.agentType()).isEqualTo(TestAgents.BOOKING);
            assertThat(summary.collectedFields()).containsEntry("destination", "Paris");
        });
        assertThat(orchestrator.getAgentStatus(TENANT, agentId)).map(AgentSummary::status)
                .contains(AgentStatus.WAITING_FOR_INPUT);
        assertThat(orchestrator.getAgentStatus(TENANT, "missing")).isEmpty();
        assertThat(orchestrator.listAgents("other-tenant")).isEmpty();
    }

    @Test
    void cancelShouldDropTheAgent() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);

        assertThat(orchestrator.cancelAgent(TENANT, agentId)).isTrue();
        assertThat(orchestrator.listAgents(TENANT)).isEmpty();
        assertThat(orchestrator.cancelAgent(TENANT, agentId)).isFalse();
    }

    @Test
    void pausedAgentShouldResumeWhereItStopped() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);

        Optional<AgentReply> paused = orchestrator.pauseAgent(TENANT, agentId);
        assertThat(paused).map(AgentReply::status).contains(AgentStatus.PAUSED);
        assertThat(orchestrator.pauseAgent(TENANT, agentId)).isEmpty();

        Optional<AgentReply> resumed = orchestrator.resumeAgent(TENANT, agentId, null);
        assertThat(resumed).hasValueSatisfying(reply -> {
            assertThat(reply.status()).isEqualTo(AgentStatus.WAITING_FOR_INPUT);
            assertThat(reply.rawMessage()).isEqualTo("Which date?");
        });
        assertThat(orchestrator.resumeAgent(TENANT, agentId, null)).isEmpty();
    }

    @Test
    void resumeWithMessageShouldContinueTheConversation() {
        Orchestrator orchestrator = orchestrator(false);
        String agentId = startBooking(orchestrator);
        orchestrator.pauseAgent(TENANT, agentId);

        Optional<AgentReply> resumed = orchestrator.resumeAgent(TENANT, agentId, "2026-07-14");

        assertThat(resumed).map(AgentReply::status).contains(AgentStatus.WAITING_FOR_APPROVAL);
        assertThat(orchestrator.pendingApprovals(TENANT)).extracting(ApprovalRequest::actionSummary)
                .containsExactly("Book Paris on 2026-07-14?");
    }

    @Test
    void unknownAgentsShouldNotBePausedOrResumed() {
        Orchestrator orchestrator = orchestrator(false);

        assertThat(orchestrator.pauseAgent(TENANT, "nope")).isEmpty();
        assertThat(orchestrator.resumeAgent(TENANT, "nope", "hi")).isEmpty();
    }

    @Test
    void lazyRestoreShouldPickUpPersistedAgentsOnFirstContact() {
        Orchestrator first = orchestrator(false);
        String agentId = startBooking(first);
        pools.get(0).flush();

        Orchestrator restarted = orchestrator(true);
        OrchestratorReply reply = restarted.handleMessage(TENANT, "2026-05-01");

        assertThat(reply.routedToAgent()).isTrue();
        assertThat(reply.agentReply().agentId()).isEqualTo(agentId);
        assertThat(reply.response()).isEqualTo("Book Paris on 2026-05-01?");
    }

    private String startBooking(Orchestrator orchestrator) {
        llm.then(ChatCompletion.toolCalls(List.of(
                new AssistantMessage.ToolCall("call_1", "function", TestAgents.BOOKING, "{\"task_instruction\":\"Paris\"}")
        )));
        OrchestratorReply reply = orchestrator.handleMessage(TENANT, "book me a trip to Paris");
        assertThat(reply.response()).isEqualTo("Which date?");
        return orchestrator.listAgents(TENANT).get(0).agentId();
    }

    private Orchestrator orchestrator(boolean lazyRestore) {
        ReactLoopConfig config = ReactLoopConfig.DEFAULT;
        AgentPool pool = new AgentPool(backend, types, Duration.ofMinutes(5), clock);
        pools.add(pool);
        ToolDispatcher dispatcher = new ToolDispatcher(new ToolRegistry(List.of()), types, pool, null, auditLogger,
                checkpointManager, objectMapper, config);
        ReactEngine engine = new ReactEngine(llm, dispatcher, new ContextManager(config), config);
        return new Orchestrator(engine, dispatcher, pool, checkpointManager, auditLogger, SYSTEM_PROMPT, lazyRestore);
    }
}
