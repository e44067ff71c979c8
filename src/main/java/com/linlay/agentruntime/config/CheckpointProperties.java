package com.linlay.agentruntime.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "agent.checkpoint")
public class CheckpointProperties {

    public enum Backend {
        MEMORY,
        EMBEDDED,
        JDBC
    }

    private boolean enabled = true;
    private Backend backend = Backend.MEMORY;
    private String embeddedPath = "./data/checkpoints";
    @Min(1)
    private int maxCheckpointsPerAgent = 1000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend == null ? Backend.MEMORY : backend;
    }

    public String getEmbeddedPath() {
        return embeddedPath;
    }

    public void setEmbeddedPath(String embeddedPath) {
        this.embeddedPath = embeddedPath;
    }

    public int getMaxCheckpointsPerAgent() {
        return maxCheckpointsPerAgent;
    }

    public void setMaxCheckpointsPerAgent(int maxCheckpointsPerAgent) {
        this.maxCheckpointsPerAgent = maxCheckpointsPerAgent;
    }
}
