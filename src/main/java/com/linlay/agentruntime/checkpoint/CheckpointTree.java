package com.linlay.agentruntime.checkpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derived view over all checkpoints of one agent. Never persisted; rebuild it with {@link #build(List)}.
 */
public final class CheckpointTree {

    private final String rootId;
    private final Map<String, CheckpointMetadata> nodes;
    private final Map<String, List<String>> children;

    private CheckpointTree(String rootId, Map<String, CheckpointMetadata> nodes, Map<String, List<String>> children) {
        this.rootId = rootId;
        this.nodes = nodes;
        this.children = children;
    }

    /**
     * Builds the tree from checkpoints in oldest-first order; the oldest one becomes the root.
     * Returns empty when there is nothing to build from.
     */
    public static Optional<CheckpointTree> build(List<Checkpoint> oldestFirst) {
        if (oldestFirst == null || oldestFirst.isEmpty()) {
            return Optional.empty();
        }
        Map<String, CheckpointMetadata> nodes = new LinkedHashMap<>();
        for (Checkpoint checkpoint : oldestFirst) {
            nodes.put(checkpoint.id(), CheckpointMetadata.from(checkpoint));
        }
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (CheckpointMetadata node : nodes.values()) {
            String parent = node.parentCheckpointId();
            if (parent != null && nodes.containsKey(parent)) {
                children.computeIfAbsent(parent, key -> new ArrayList<>()).add(node.id());
            }
        }
        Map<String, List<String>> frozenChildren = new LinkedHashMap<>();
        children.forEach((key, value) -> frozenChildren.put(key, List.copyOf(value)));
        return Optional.of(new CheckpointTree(
                oldestFirst.get(0).id(),
                Collections.unmodifiableMap(nodes),
                Collections.unmodifiableMap(frozenChildren)
        ));
    }

    public String rootId() {
        return rootId;
    }

    public Map<String, CheckpointMetadata> nodes() {
        return nodes;
    }

    public Map<String, List<String>> children() {
        return children;
    }

    public boolean contains(String checkpointId) {
        return nodes.containsKey(checkpointId);
    }

    /**
     * Walks parent links from {@code checkpointId} up to the root, both inclusive, leaf first.
     */
    public List<CheckpointMetadata> pathToRoot(String checkpointId) {
        List<CheckpointMetadata> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String current = checkpointId;
        while (current != null && visited.add(current)) {
            CheckpointMetadata node = nodes.get(current);
            if (node == null) {
                break;
            }
            path.add(node);
            current = node.parentCheckpointId();
        }
        return path;
    }

    public List<CheckpointMetadata> branches(String checkpointId) {
        return children.getOrDefault(checkpointId, List.of()).stream()
                .map(nodes::get)
                .toList();
    }

    public List<CheckpointMetadata> leafNodes() {
        return nodes.values().stream()
                .filter(node -> !children.containsKey(node.id()))
                .sorted(Comparator.comparing(CheckpointMetadata::timestamp))
                .toList();
    }

    /**
     * Number of edges between the checkpoint and the root; -1 when the checkpoint is not in this tree.
     */
    public int depth(String checkpointId) {
        return pathToRoot(checkpointId).size() - 1;
    }
}
