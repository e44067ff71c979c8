package com.linlay.agentruntime.checkpoint;

public class CheckpointNotFoundException extends RuntimeException {

    public CheckpointNotFoundException(String checkpointId) {
        super("checkpoint not found: " + checkpointId);
    }
}
