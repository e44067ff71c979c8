package com.linlay.agentruntime.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "agent.session")
public class SessionProperties {

    public enum Backend {
        MEMORY,
        REDIS,
        JDBC
    }

    private boolean enabled = true;
    private Backend backend = Backend.MEMORY;
    @Min(1)
    private long sessionTtlSeconds = 86_400;
    @Min(1)
    private long activeTtlSeconds = 600;
    @Min(1)
    private long autoBackupIntervalSeconds = 60;
    @Min(1)
    private long cleanupIntervalSeconds = 300;
    private boolean autoRestoreOnStart = false;
    private boolean lazyRestore = true;
    @Min(1)
    private long waitingTimeoutSeconds = 300;
    @NotBlank
    private String keyPrefix = "agent-runtime";

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

    public long getSessionTtlSeconds() {
        return sessionTtlSeconds;
    }

    public void setSessionTtlSeconds(long sessionTtlSeconds) {
        this.sessionTtlSeconds = sessionTtlSeconds;
    }

    public long getActiveTtlSeconds() {
        return activeTtlSeconds;
    }

    public void setActiveTtlSeconds(long activeTtlSeconds) {
        this.activeTtlSeconds = activeTtlSeconds;
    }

    public long getAutoBackupIntervalSeconds() {
        return autoBackupIntervalSeconds;
    }

    public void setAutoBackupIntervalSeconds(long autoBackupIntervalSeconds) {
        this.autoBackupIntervalSeconds = autoBackupIntervalSeconds;
    }

    public long getCleanupIntervalSeconds() {
        return cleanupIntervalSeconds;
    }

    public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) {
        this.cleanupIntervalSeconds = cleanupIntervalSeconds;
    }

    public boolean isAutoRestoreOnStart() {
        return autoRestoreOnStart;
    }

    public void setAutoRestoreOnStart(boolean autoRestoreOnStart) {
        this.autoRestoreOnStart = autoRestoreOnStart;
    }

    public boolean isLazyRestore() {
        return lazyRestore;
    }

    public void setLazyRestore(boolean lazyRestore) {
        this.lazyRestore = lazyRestore;
    }

    public long getWaitingTimeoutSeconds() {
        return waitingTimeoutSeconds;
    }

    public void setWaitingTimeoutSeconds(long waitingTimeoutSeconds) {
        this.waitingTimeoutSeconds = waitingTimeoutSeconds;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }
}
