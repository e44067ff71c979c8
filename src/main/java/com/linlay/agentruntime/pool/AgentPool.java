package com.linlay.agentruntime.pool;

import com.linlay.agentruntime.agent.Agent;
import com.linlay.agentruntime.agent.AgentStatus;
import com.linlay.agentruntime.agent.AgentTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Per-tenant cache of live agents mirrored into a {@link PoolBackend}.
 * <p>
 * The in-memory map is guarded by one lock. Backend writes go through a single writer thread so that
 * entries for the same agent reach the backend in the order they were produced.
 */
public class AgentPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);
    private static final long FLUSH_TIMEOUT_SECONDS = 30;

    private final PoolBackend backend;
    private final AgentTypeRegistry typeRegistry;
    private final Duration waitingTimeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Agent>> agentsByTenant = new LinkedHashMap<>();
    private final Map<String, String> checkpointIds = new LinkedHashMap<>();
    private final ExecutorService writer = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "agent-pool-writer");
        thread.setDaemon(true);
        return thread;
    });

    public AgentPool(PoolBackend backend, AgentTypeRegistry typeRegistry, Duration waitingTimeout, Clock clock) {
        this.backend = backend;
        this.typeRegistry = typeRegistry;
        this.waitingTimeout = waitingTimeout == null ? Duration.ofSeconds(300) : waitingTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PoolBackend backend() {
        return backend;
    }

    public void add(Agent agent) {
        lock.lock();
        try {
            agentsByTenant.computeIfAbsent(agent.tenantId(), key -> new LinkedHashMap<>()).put(agent.id(), agent);
        } finally {
            lock.unlock();
        }
        persistAsync(agent);
        log.debug("[pool] added {} for tenant {}", agent.id(), agent.tenantId());
    }

    public void update(Agent agent) {
        add(agent);
    }

    public Optional<Agent> get(String tenantId, String agentId) {
        lock.lock();
        try {
            return Optional.ofNullable(agentsByTenant.getOrDefault(tenantId, Map.of()).get(agentId));
        } finally {
            lock.unlock();
        }
    }

    public List<Agent> list(String tenantId) {
        lock.lock();
        try {
            return new ArrayList<>(agentsByTenant.getOrDefault(tenantId, Map.of()).values());
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String tenantId, String agentId) {
        Agent removed;
        lock.lock();
        try {
            Map<String, Agent> agents = agentsByTenant.get(tenantId);
            removed = agents == null ? null : agents.remove(agentId);
            if (agents != null && agents.isEmpty()) {
                agentsByTenant.remove(tenantId);
            }
            checkpointIds.remove(agentId);
        } finally {
            lock.unlock();
        }
        submit("remove " + tenantId + "/" + agentId, () -> backend.removeAgent(tenantId, agentId));
        return removed != null;
    }

    public boolean hasAgentsInMemory(String tenantId) {
        lock.lock();
        try {
            Map<String, Agent> agents = agentsByTenant.get(tenantId);
            return agents != null && !agents.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getActiveTenants() {
        Set<String> tenants = new LinkedHashSet<>();
        lock.lock();
        try {
            tenants.addAll(agentsByTenant.keySet());
        } finally {
            lock.unlock();
        }
        tenants.addAll(backend.getActiveTenants());
        return tenants;
    }

    /**
     * Most recently active agent of the tenant that is waiting for input or approval.
     */
    public Optional<Agent> getWaitingAgent(String tenantId) {
        return list(tenantId).stream()
                .filter(agent -> agent.status().isWaiting())
                .max(Comparator.comparing(Agent::lastActivity));
    }

    public void recordCheckpoint(String agentId, String checkpointId) {
        lock.lock();
        try {
            checkpointIds.put(agentId, checkpointId);
        } finally {
            lock.unlock();
        }
    }

    public int clearTenant(String tenantId) {
        int inMemory;
        lock.lock();
        try {
            Map<String, Agent> removed = agentsByTenant.remove(tenantId);
            inMemory = removed == null ? 0 : removed.size();
            if (removed != null) {
                removed.keySet().forEach(checkpointIds::remove);
            }
        } finally {
            lock.unlock();
        }
        submit("clear " + tenantId, () -> backend.clearTenant(tenantId));
        return inMemory;
    }

    /**
     * Reloads persisted agents of one tenant. Entries whose schema version no longer matches the
     * registered type are dropped from the backend instead of being restored.
     */
    public int restoreTenantSession(String tenantId, Function<PoolEntry, Agent> factory) {
        flush();
        int restored = 0;
        for (PoolEntry entry : backend.listAgents(tenantId)) {
            if (get(tenantId, entry.agentId()).isPresent()) {
                continue;
            }
            if (entry.status() == null || entry.status().isTerminal()) {
                backend.removeAgent(tenantId, entry.agentId());
                continue;
            }
            Optional<Integer> currentVersion = typeRegistry.find(entry.agentType()).map(type -> type.schemaVersion());
            if (currentVersion.isEmpty()) {
                log.warn("[pool] discard {}/{}: agent type '{}' is not registered",
                        tenantId, entry.agentId(), entry.agentType());
                backend.removeAgent(tenantId, entry.agentId());
                continue;
            }
            if (currentVersion.get() != entry.schemaVersion()) {
                log.warn("[pool] discard stale {}/{}: schema version {} != current {}",
                        tenantId, entry.agentId(), entry.schemaVersion(), currentVersion.get());
                backend.removeAgent(tenantId, entry.agentId());
                continue;
            }
            try {
                Agent agent = factory.apply(entry);
                lock.lock();
                try {
                    agentsByTenant.computeIfAbsent(tenantId, key -> new LinkedHashMap<>()).put(agent.id(), agent);
                    if (entry.checkpointId() != null) {
                        checkpointIds.put(agent.id(), entry.checkpointId());
                    }
                } finally {
                    lock.unlock();
                }
                restored++;
            } catch (RuntimeException ex) {
                log.error("[pool] failed to restore {}/{}: {}", tenantId, entry.agentId(), ex.getMessage(), ex);
            }
        }
        if (restored > 0) {
            log.info("[pool] restored {} agent(s) for tenant {}", restored, tenantId);
        }
        return restored;
    }

    public int restoreTenantSession(String tenantId) {
        return restoreTenantSession(tenantId, this::createFromEntry);
    }

    public int restoreAllSessions(Function<PoolEntry, Agent> factory) {
        int total = 0;
        for (String tenantId : backend.getActiveTenants()) {
            total += restoreTenantSession(tenantId, factory);
        }
        log.info("[pool] restored {} agent session(s)", total);
        return total;
    }

    public int restoreAllSessions() {
        return restoreAllSessions(this::createFromEntry);
    }

    /**
     * Agents waiting for the user longer than the waiting timeout are failed and dropped.
     */
    public int cleanupTimedOutAgents() {
        Instant cutoff = clock.instant().minus(waitingTimeout);
        List<Agent> expired = new ArrayList<>();
        lock.lock();
        try {
            for (Map<String, Agent> agents : agentsByTenant.values()) {
                for (Agent agent : agents.values()) {
                    if (agent.status().isWaiting() && agent.lastActivity().isBefore(cutoff)) {
                        expired.add(agent);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        for (Agent agent : expired) {
            log.info("[pool] agent {} waited longer than {}s, marking as error", agent.id(), waitingTimeout.toSeconds());
            agent.transitionTo(AgentStatus.ERROR);
            remove(agent.tenantId(), agent.id());
        }
        return expired.size();
    }

    public int cleanupExpiredEntries() {
        return backend.cleanupExpired();
    }

    /**
     * Writes every in-memory agent to the backend and waits for completion.
     */
    public int backupAll() {
        List<Agent> snapshot = new ArrayList<>();
        lock.lock();
        try {
            agentsByTenant.values().forEach(agents -> snapshot.addAll(agents.values()));
        } finally {
            lock.unlock();
        }
        snapshot.forEach(this::persistAsync);
        flush();
        log.debug("[pool] backed up {} agent(s)", snapshot.size());
        return snapshot.size();
    }

    /**
     * Blocks until all queued backend writes have run.
     */
    public void flush() {
        Future<?> marker = writer.submit(() -> {
        });
        try {
            marker.get(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while flushing agent pool", ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new IllegalStateException("Agent pool flush failed", ex);
        }
    }

    @Override
    public void close() {
        backupAll();
        writer.shutdown();
        try {
            if (!writer.awaitTermination(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[pool] writer did not stop within {}s", FLUSH_TIMEOUT_SECONDS);
                writer.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        backend.close();
    }

    private Agent createFromEntry(PoolEntry entry) {
        Agent agent = typeRegistry.create(entry.agentType(), entry.tenantId(), entry.context());
        agent.restoreState(entry.agentId(), entry.status(), entry.collectedFields(), entry.executionState(), entry.context());
        return agent;
    }

    private void persistAsync(Agent agent) {
        String checkpointId;
        lock.lock();
        try {
            checkpointId = checkpointIds.get(agent.id());
        } finally {
            lock.unlock();
        }
        PoolEntry entry = PoolEntry.of(agent, typeRegistry.schemaVersion(agent.type()), checkpointId);
        submit("save " + agent.tenantId() + "/" + agent.id(), () -> backend.saveAgent(entry));
    }

    private void submit(String description, Runnable write) {
        writer.execute(() -> {
            try {
                write.run();
            } catch (RuntimeException ex) {
                log.warn("[pool] backend write failed ({}): {}", description, ex.getMessage(), ex);
            }
        });
    }
}
