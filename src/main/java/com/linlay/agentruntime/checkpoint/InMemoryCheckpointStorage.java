package com.linlay.agentruntime.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

public class InMemoryCheckpointStorage implements CheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStorage.class);

    public static final int DEFAULT_MAX_PER_AGENT = 1000;

    private static final Comparator<Stored> OLDEST_FIRST = Comparator
            .comparing((Stored stored) -> stored.checkpoint().timestamp())
            .thenComparingLong(Stored::sequence);

    private final int maxCheckpointsPerAgent;
    private final Map<String, Stored> byId = new LinkedHashMap<>();
    private final Map<String, List<String>> idsByAgent = new HashMap<>();
    private long sequence;

    public InMemoryCheckpointStorage() {
        this(DEFAULT_MAX_PER_AGENT);
    }

    public InMemoryCheckpointStorage(int maxCheckpointsPerAgent) {
        this.maxCheckpointsPerAgent = maxCheckpointsPerAgent > 0 ? maxCheckpointsPerAgent : DEFAULT_MAX_PER_AGENT;
    }

    @Override
    public synchronized String save(Checkpoint checkpoint) {
        Stored previous = byId.remove(checkpoint.id());
        if (previous != null) {
            idsByAgent.getOrDefault(previous.checkpoint().agentId(), new ArrayList<>()).remove(checkpoint.id());
        }
        byId.put(checkpoint.id(), new Stored(checkpoint, ++sequence));
        List<String> agentIds = idsByAgent.computeIfAbsent(checkpoint.agentId(), key -> new ArrayList<>());
        agentIds.add(checkpoint.id());
        while (agentIds.size() > maxCheckpointsPerAgent) {
            String oldest = agentIds.stream()
                    .map(byId::get)
                    .min(OLDEST_FIRST)
                    .map(stored -> stored.checkpoint().id())
                    .orElseThrow();
            agentIds.remove(oldest);
            byId.remove(oldest);
            log.debug("[checkpoint] evicted {} for agent {} (limit {})", oldest, checkpoint.agentId(), maxCheckpointsPerAgent);
        }
        return checkpoint.id();
    }

    @Override
    public synchronized Optional<Checkpoint> get(String checkpointId) {
        Stored stored = byId.get(checkpointId);
        return stored == null ? Optional.empty() : Optional.of(stored.checkpoint());
    }

    @Override
    public synchronized boolean delete(String checkpointId) {
        Stored removed = byId.remove(checkpointId);
        if (removed == null) {
            return false;
        }
        List<String> agentIds = idsByAgent.get(removed.checkpoint().agentId());
        if (agentIds != null) {
            agentIds.remove(checkpointId);
            if (agentIds.isEmpty()) {
                idsByAgent.remove(removed.checkpoint().agentId());
            }
        }
        return true;
    }

    @Override
    public synchronized List<CheckpointMetadata> listByAgent(String agentId, int limit, int offset) {
        return page(stored -> stored.checkpoint().agentId().equals(agentId), limit, offset);
    }

    @Override
    public synchronized List<CheckpointMetadata> listByTenant(String tenantId, int limit, int offset) {
        return page(stored -> stored.checkpoint().tenantId().equals(tenantId), limit, offset);
    }

    @Override
    public synchronized Optional<CheckpointTree> getTree(String agentId) {
        List<Checkpoint> oldestFirst = agentCheckpoints(agentId).stream()
                .sorted(OLDEST_FIRST)
                .map(Stored::checkpoint)
                .toList();
        return CheckpointTree.build(oldestFirst);
    }

    @Override
    public synchronized Optional<Checkpoint> getLatest(String agentId) {
        return agentCheckpoints(agentId).stream()
                .max(OLDEST_FIRST)
                .map(Stored::checkpoint);
    }

    @Override
    public synchronized int clearAgent(String agentId) {
        List<String> ids = idsByAgent.remove(agentId);
        if (ids == null) {
            return 0;
        }
        ids.forEach(byId::remove);
        return ids.size();
    }

    @Override
    public synchronized int clearTenant(String tenantId) {
        List<String> ids = byId.values().stream()
                .filter(stored -> stored.checkpoint().tenantId().equals(tenantId))
                .map(stored -> stored.checkpoint().id())
                .toList();
        ids.forEach(this::delete);
        return ids.size();
    }

    public synchronized int size() {
        return byId.size();
    }

    private List<Stored> agentCheckpoints(String agentId) {
        return idsByAgent.getOrDefault(agentId, List.of()).stream()
                .map(byId::get)
                .toList();
    }

    private List<CheckpointMetadata> page(Predicate<Stored> filter, int limit, int offset) {
        return byId.values().stream()
                .filter(filter)
                .sorted(OLDEST_FIRST.reversed())
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .map(stored -> CheckpointMetadata.from(stored.checkpoint()))
                .toList();
    }

    private record Stored(Checkpoint checkpoint, long sequence) {
    }
}
