package com.linlay.agentruntime.pool;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage behind {@link AgentPool}. Implementations keep at most one entry per (tenant, agent) pair.
 */
public interface PoolBackend extends AutoCloseable {

    void saveAgent(PoolEntry entry);

    Optional<PoolEntry> getAgent(String tenantId, String agentId);

    List<PoolEntry> listAgents(String tenantId);

    boolean removeAgent(String tenantId, String agentId);

    int clearTenant(String tenantId);

    Set<String> getActiveTenants();

    /**
     * Deletes entries past their TTL. Backends that expire entries on their own return 0.
     */
    default int cleanupExpired() {
        return 0;
    }

    @Override
    default void close() {
    }
}
