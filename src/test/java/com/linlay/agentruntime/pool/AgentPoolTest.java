package com.linlay.agentruntime.pool;

import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentStatus;
import com.linlay.agentruntime.agent.AgentTypeRegistry;
import com.linlay.agentruntime.agent.TestAgents;
import com.linlay.agentruntime.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgentPoolTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
    private final AgentTypeRegistry registry = TestAgents.registry(clock);
    private final InMemoryPoolBackend backend = new InMemoryPoolBackend();
    private final AgentPool pool = new AgentPool(backend, registry, Duration.ofMinutes(5), clock);

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void addedAgentShouldBeVisibleInMemoryAndReachTheBackend() {
        Agent agent = booking("tenant-a");

        pool.add(agent);
        pool.flush();

        assertThat(pool.get("tenant-a", agent.id())).containsSame(agent);
        assertThat(pool.list("tenant-a")).containsExactly(agent);
        assertThat(pool.hasAgentsInMemory("tenant-a")).isTrue();
        PoolEntry entry = backend.getAgent("tenant-a", agent.id()).orElseThrow();
        assertThat(entry.agentType()).isEqualTo("booking");
        assertThat(entry.schemaVersion()).isEqualTo(registry.schemaVersion("booking"));
        assertThat(pool.get("tenant-b", agent.id())).isEmpty();
    }

    @Test
    void backendShouldEndUpWithTheLastUpdate() {
        Agent agent = booking("tenant-a");
        pool.add(agent);
        agent.reply("Rome");
        pool.update(agent);
        agent.reply("2026-05-01");
        pool.update(agent);
        pool.flush();

        PoolEntry entry = backend.getAgent("tenant-a", agent.id()).orElseThrow();
        assertThat(entry.status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
        assertThat(entry.collectedFields()).containsOnlyKeys("destination", "date");
    }

    @Test
    void removeShouldDropAgentEverywhere() {
        Agent agent = booking("tenant-a");
        pool.add(agent);

        assertThat(pool.remove("tenant-a", agent.id())).isTrue();
        assertThat(pool.remove("tenant-a", agent.id())).isFalse();
        pool.flush();

        assertThat(pool.hasAgentsInMemory("tenant-a")).isFalse();
        assertThat(backend.listAgents("tenant-a")).isEmpty();
    }

    @Test
    void waitingAgentShouldBeTheMostRecentlyActiveOne() {
        Agent older = booking("tenant-a");
        older.reply("Rome");
        clock.advance(Duration.ofSeconds(30));
        Agent newer = booking("tenant-a");
        newer.reply("Oslo");
        Agent running = booking("tenant-a");
        pool.add(older);
        pool.add(newer);
        pool.add(running);

        assertThat(pool.getWaitingAgent("tenant-a")).containsSame(newer);
        assertThat(pool.getWaitingAgent("tenant-b")).isEmpty();
    }

    @Test
    void recordedCheckpointShouldBePersistedWithTheEntry() {
        Agent agent = booking("tenant-a");
        pool.recordCheckpoint(agent.id(), "ckpt_42");

        pool.add(agent);
        pool.flush();

        assertThat(backend.getAgent("tenant-a", agent.id()).orElseThrow().checkpointId()).isEqualTo("ckpt_42");
    }

    @Test
    void restoreShouldRebuildAgentsFromBackendEntries() {
        int version = registry.schemaVersion("booking");
        backend.saveAgent(entry("tenant-a", "booking_saved", "booking", AgentStatus.WAITING_FOR_INPUT, version,
                Map.of("destination", "Rome")));

        int restored = pool.restoreTenantSession("tenant-a");

        assertThat(restored).isEqualTo(1);
        Agent agent = pool.get("tenant-a", "booking_saved").orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.WAITING_FOR_INPUT);
        assertThat(agent.collectedFields()).containsEntry("destination", "Rome");
        assertThat(agent.reply("2026-05-01").status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
    }

    @Test
    void staleUnknownAndTerminalEntriesShouldBeDiscardedOnRestore() {
        int version = registry.schemaVersion("booking");
        backend.saveAgent(entry("tenant-a", "stale", "booking", AgentStatus.WAITING_FOR_INPUT, version + 1, Map.of()));
        backend.saveAgent(entry("tenant-a", "unknown", "travel", AgentStatus.WAITING_FOR_INPUT, 0, Map.of()));
        backend.saveAgent(entry("tenant-a", "finished", "booking", AgentStatus.COMPLETED, version, Map.of()));
        backend.saveAgent(entry("tenant-a", "good", "booking", AgentStatus.WAITING_FOR_APPROVAL, version, Map.of()));

        int restored = pool.restoreTenantSession("tenant-a");

        assertThat(restored).isEqualTo(1);
        assertThat(pool.list("tenant-a")).extracting(Agent::id).containsExactly("good");
        assertThat(backend.listAgents("tenant-a")).extracting(PoolEntry::agentId).containsExactly("good");
    }

    @Test
    void restoreShouldNotReplaceAgentsAlreadyInMemory() {
        Agent live = booking("tenant-a");
        live.reply("Rome");
        pool.add(live);
        pool.flush();

        assertThat(pool.restoreTenantSession("tenant-a")).isZero();
        assertThat(pool.get("tenant-a", live.id())).containsSame(live);
    }

    @Test
    void restoreAllShouldVisitEveryTenantInTheBackend() {
        int version = registry.schemaVersion("booking");
        backend.saveAgent(entry("tenant-a", "a1", "booking", AgentStatus.WAITING_FOR_INPUT, version, Map.of()));
        backend.saveAgent(entry("tenant-b", "b1", "booking", AgentStatus.PAUSED, version, Map.of()));

        assertThat(pool.restoreAllSessions()).isEqualTo(2);
        assertThat(pool.getActiveTenants()).containsExactlyInAnyOrder("tenant-a", "tenant-b");
    }

    @Test
    void agentsWaitingPastTheTimeoutShouldBeFailedAndRemoved() {
        Agent stale = booking("tenant-a");
        stale.reply("Rome");
        pool.add(stale);
        clock.advance(Duration.ofMinutes(4));
        Agent fresh = booking("tenant-a");
        fresh.reply("Oslo");
        pool.add(fresh);
        clock.advance(Duration.ofMinutes(2));

        assertThat(pool.cleanupTimedOutAgents()).isEqualTo(1);
        assertThat(stale.status()).isEqualTo(AgentStatus.ERROR);
        assertThat(pool.list("tenant-a")).containsExactly(fresh);
    }

    @Test
    void clearTenantShouldOnlyTouchThatTenant() {
        pool.add(booking("tenant-a"));
        pool.add(booking("tenant-a"));
        Agent other = booking("tenant-b");
        pool.add(other);

        assertThat(pool.clearTenant("tenant-a")).isEqualTo(2);
        pool.flush();

        assertThat(backend.listAgents("tenant-a")).isEmpty();
        assertThat(pool.list("tenant-b")).containsExactly(other);
        assertThat(pool.getActiveTenants()).containsExactly("tenant-b");
    }

    @Test
    void backupAllShouldRewriteEveryLiveAgent() {
        Agent agent = booking("tenant-a");
        pool.add(agent);
        pool.flush();
        backend.clearTenant("tenant-a");

        assertThat(pool.backupAll()).isEqualTo(1);
        assertThat(backend.getAgent("tenant-a", agent.id())).isPresent();
    }

    private Agent booking(String tenantId) {
        return registry.create("booking", tenantId, Map.of());
    }

    private PoolEntry entry(String tenantId, String agentId, String type, AgentStatus status, int version,
                            Map<String, Object> fields) {
        Instant now = clock.instant();
        return new PoolEntry(agentId, type, tenantId, status, now, now, fields, Map.of(), Map.of(), null, version);
    }
}
