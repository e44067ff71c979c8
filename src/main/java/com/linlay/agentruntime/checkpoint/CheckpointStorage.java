package com.linlay.agentruntime.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for checkpoints. Listings are newest first; ties on timestamp are broken by save order.
 */
public interface CheckpointStorage extends AutoCloseable {

    String save(Checkpoint checkpoint);

    Optional<Checkpoint> get(String checkpointId);

    boolean delete(String checkpointId);

    List<CheckpointMetadata> listByAgent(String agentId, int limit, int offset);

    List<CheckpointMetadata> listByTenant(String tenantId, int limit, int offset);

    Optional<CheckpointTree> getTree(String agentId);

    Optional<Checkpoint> getLatest(String agentId);

    int clearAgent(String agentId);

    int clearTenant(String tenantId);

    @Override
    default void close() {
    }
}
