package com.linlay.agentruntime.pool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local backend without TTL. Entries live until removed or the process exits.
 */
public class InMemoryPoolBackend implements PoolBackend {

    private final Map<String, Map<String, PoolEntry>> entries = new LinkedHashMap<>();

    @Override
    public synchronized void saveAgent(PoolEntry entry) {
        entries.computeIfAbsent(entry.tenantId(), key -> new LinkedHashMap<>()).put(entry.agentId(), entry);
    }

    @Override
    public synchronized Optional<PoolEntry> getAgent(String tenantId, String agentId) {
        return Optional.ofNullable(entries.getOrDefault(tenantId, Map.of()).get(agentId));
    }

    @Override
    public synchronized List<PoolEntry> listAgents(String tenantId) {
        return new ArrayList<>(entries.getOrDefault(tenantId, Map.of()).values());
    }

    @Override
    public synchronized boolean removeAgent(String tenantId, String agentId) {
        Map<String, PoolEntry> tenantEntries = entries.get(tenantId);
        if (tenantEntries == null || tenantEntries.remove(agentId) == null) {
            return false;
        }
        if (tenantEntries.isEmpty()) {
            entries.remove(tenantId);
        }
        return true;
    }

    @Override
    public synchronized int clearTenant(String tenantId) {
        Map<String, PoolEntry> removed = entries.remove(tenantId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public synchronized Set<String> getActiveTenants() {
        return new LinkedHashSet<>(entries.keySet());
    }
}
