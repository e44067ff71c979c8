package com.linlay.agentruntime.checkpoint;

import com.linlay.agentruntime.agent.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Saves and replays agent checkpoints. Tracks the last checkpoint per agent so every save links to its
 * parent; {@link #replayFrom(String, String)} moves that pointer to start a new branch.
 * <p>
 * Saves and replays of one agent run under a per-agent lock, so two replays against the same agent
 * are applied one after the other and each following save links to the pointer the latest replay set.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final CheckpointStorage storage;
    private final Clock clock;
    private final Map<String, String> lastCheckpointByAgent = new ConcurrentHashMap<>();
    private final Map<String, String> pendingBranchLabelByAgent = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();

    public CheckpointManager(CheckpointStorage storage) {
        this(storage, Clock.systemUTC());
    }

    public CheckpointManager(CheckpointStorage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public CheckpointStorage storage() {
        return storage;
    }

    public Checkpoint saveCheckpoint(
            Agent agent,
            Map<String, Object> message,
            Map<String, Object> result,
            List<Map<String, Object>> messageHistory,
            String branchLabel
    ) {
        return withAgentLock(agent.id(), () -> {
            String label = StringUtils.hasText(branchLabel)
                    ? branchLabel
                    : pendingBranchLabelByAgent.remove(agent.id());
            Checkpoint checkpoint = new Checkpoint(
                    Checkpoint.newId(),
                    agent.id(),
                    agent.type(),
                    agent.tenantId(),
                    agent.status(),
                    agent.collectedFields(),
                    agent.executionState(),
                    agent.context(),
                    message,
                    result,
                    messageHistory,
                    existingParent(agent.id()),
                    label,
                    clock.instant(),
                    Checkpoint.CURRENT_VERSION
            );
            storage.save(checkpoint);
            lastCheckpointByAgent.put(agent.id(), checkpoint.id());
            log.debug("[checkpoint] saved {} for {} parent={} status={}",
                    checkpoint.id(), agent.id(), checkpoint.parentCheckpointId(), checkpoint.status());
            return checkpoint;
        });
    }

    public Checkpoint saveCheckpoint(Agent agent) {
        return saveCheckpoint(agent, null, null, null, null);
    }

    public Checkpoint getAgentState(String checkpointId) {
        return storage.get(checkpointId).orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
    }

    /**
     * Loads the snapshot into {@code agent} and makes it the parent of the agent's next checkpoint.
     */
    public Checkpoint restoreAgent(String checkpointId, Agent agent) {
        Checkpoint checkpoint = getAgentState(checkpointId);
        return withAgentLock(checkpoint.agentId(), () -> {
            agent.restoreState(
                    checkpoint.agentId(),
                    checkpoint.status(),
                    checkpoint.collectedFields(),
                    checkpoint.executionState(),
                    checkpoint.context()
            );
            lastCheckpointByAgent.put(checkpoint.agentId(), checkpoint.id());
            log.info("[checkpoint] restored {} from {}", checkpoint.agentId(), checkpointId);
            return checkpoint;
        });
    }

    /**
     * Points the agent back at {@code checkpointId}; the next save becomes a new branch under it.
     */
    public Checkpoint replayFrom(String checkpointId, String branchLabel) {
        Checkpoint checkpoint = getAgentState(checkpointId);
        return withAgentLock(checkpoint.agentId(), () -> {
            lastCheckpointByAgent.put(checkpoint.agentId(), checkpoint.id());
            if (StringUtils.hasText(branchLabel)) {
                pendingBranchLabelByAgent.put(checkpoint.agentId(), branchLabel.trim());
            } else {
                pendingBranchLabelByAgent.remove(checkpoint.agentId());
            }
            log.info("[checkpoint] replay {} from {} branch={}", checkpoint.agentId(), checkpointId, branchLabel);
            return checkpoint;
        });
    }

    public CheckpointDiff compare(String fromCheckpointId, String toCheckpointId) {
        return CheckpointDiff.compute(getAgentState(fromCheckpointId), getAgentState(toCheckpointId));
    }

    public List<CheckpointMetadata> history(String agentId, int limit, int offset) {
        return storage.listByAgent(agentId, limit, offset);
    }

    public Optional<CheckpointTree> tree(String agentId) {
        return storage.getTree(agentId);
    }

    public boolean delete(String checkpointId) {
        Optional<Checkpoint> existing = storage.get(checkpointId);
        boolean deleted = storage.delete(checkpointId);
        existing.ifPresent(checkpoint -> lastCheckpointByAgent.remove(checkpoint.agentId(), checkpointId));
        return deleted;
    }

    public int clearAgentHistory(String agentId) {
        return withAgentLock(agentId, () -> {
            lastCheckpointByAgent.remove(agentId);
            pendingBranchLabelByAgent.remove(agentId);
            int removed = storage.clearAgent(agentId);
            log.info("[checkpoint] cleared {} checkpoint(s) of agent {}", removed, agentId);
            return removed;
        });
    }

    public int clearTenantHistory(String tenantId) {
        Set<String> agentIds = storage.listByTenant(tenantId, Integer.MAX_VALUE, 0).stream()
                .map(CheckpointMetadata::agentId)
                .collect(Collectors.toSet());
        int removed = storage.clearTenant(tenantId);
        for (String agentId : agentIds) {
            withAgentLock(agentId, () -> {
                lastCheckpointByAgent.remove(agentId);
                pendingBranchLabelByAgent.remove(agentId);
                return null;
            });
        }
        log.info("[checkpoint] cleared {} checkpoint(s) of tenant {}", removed, tenantId);
        return removed;
    }

    /**
     * Overrides the parent of the agent's next checkpoint. The checkpoint must exist; a blank id makes the
     * next save a new root.
     */
    public void setParentCheckpoint(String agentId, String checkpointId) {
        if (StringUtils.hasText(checkpointId) && storage.get(checkpointId).isEmpty()) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        withAgentLock(agentId, () -> {
            if (StringUtils.hasText(checkpointId)) {
                lastCheckpointByAgent.put(agentId, checkpointId);
            } else {
                lastCheckpointByAgent.remove(agentId);
            }
            return null;
        });
    }

    public Optional<String> getParentCheckpoint(String agentId) {
        return Optional.ofNullable(lastCheckpointByAgent.get(agentId));
    }

    /**
     * The tracked parent, or null once it has been deleted, evicted or cleared from storage.
     */
    private String existingParent(String agentId) {
        String parent = lastCheckpointByAgent.get(agentId);
        if (parent == null || storage.get(parent).isPresent()) {
            return parent;
        }
        lastCheckpointByAgent.remove(agentId, parent);
        log.debug("[checkpoint] parent {} of {} no longer stored, starting a new root", parent, agentId);
        return null;
    }

    private <T> T withAgentLock(String agentId, Supplier<T> action) {
        ReentrantLock lock = agentLocks.computeIfAbsent(agentId, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
