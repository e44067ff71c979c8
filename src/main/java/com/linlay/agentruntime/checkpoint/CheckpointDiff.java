package com.linlay.agentruntime.checkpoint;

import com.linlay.agentruntime.agent.AgentStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record CheckpointDiff(
        String fromCheckpointId,
        String toCheckpointId,
        boolean statusChanged,
        AgentStatus oldStatus,
        AgentStatus newStatus,
        Map<String, Object> fieldsAdded,
        List<String> fieldsRemoved,
        Map<String, ValueChange> fieldsModified,
        boolean executionStateChanged
) {

    public record ValueChange(Object oldValue, Object newValue) {
    }

    public static CheckpointDiff compute(Checkpoint from, Checkpoint to) {
        Objects.requireNonNull(from, "from checkpoint must not be null");
        Objects.requireNonNull(to, "to checkpoint must not be null");

        boolean statusChanged = from.status() != to.status();
        Map<String, Object> oldFields = from.collectedFields();
        Map<String, Object> newFields = to.collectedFields();

        Map<String, Object> added = new LinkedHashMap<>();
        Map<String, ValueChange> modified = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : newFields.entrySet()) {
            if (!oldFields.containsKey(entry.getKey())) {
                added.put(entry.getKey(), entry.getValue());
                continue;
            }
            Object oldValue = oldFields.get(entry.getKey());
            if (!Objects.equals(oldValue, entry.getValue())) {
                modified.put(entry.getKey(), new ValueChange(oldValue, entry.getValue()));
            }
        }
        List<String> removed = oldFields.keySet().stream()
                .filter(key -> !newFields.containsKey(key))
                .toList();

        return new CheckpointDiff(
                from.id(),
                to.id(),
                statusChanged,
                statusChanged ? from.status() : null,
                statusChanged ? to.status() : null,
                Collections.unmodifiableMap(added),
                removed,
                Collections.unmodifiableMap(modified),
                !Objects.equals(from.executionState(), to.executionState())
        );
    }

    public boolean hasChanges() {
        return statusChanged
                || !fieldsAdded.isEmpty()
                || !fieldsRemoved.isEmpty()
                || !fieldsModified.isEmpty()
                || executionStateChanged;
    }
}
