package com.linlay.agentruntime.pool;

import com.linlay.agentruntime.config.SessionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic backup and cleanup of the agent pool, plus the optional restore of all sessions at startup.
 */
@Component
public class AgentPoolMaintenance {

    private static final Logger log = LoggerFactory.getLogger(AgentPoolMaintenance.class);

    private final AgentPool agentPool;
    private final SessionProperties properties;

    public AgentPoolMaintenance(AgentPool agentPool, SessionProperties properties) {
        this.agentPool = agentPool;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreOnStartup() {
        if (!properties.isEnabled() || !properties.isAutoRestoreOnStart()) {
            return;
        }
        try {
            int restored = agentPool.restoreAllSessions();
            log.info("[pool] startup restore finished, {} agent(s) back in memory", restored);
        } catch (RuntimeException ex) {
            log.error("[pool] startup restore failed: {}", ex.getMessage(), ex);
        }
    }

    @Scheduled(
            initialDelayString = "${agent.session.auto-backup-interval-seconds:60}",
            fixedDelayString = "${agent.session.auto-backup-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS
    )
    public void backup() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            agentPool.backupAll();
        } catch (RuntimeException ex) {
            log.warn("[pool] scheduled backup failed: {}", ex.getMessage(), ex);
        }
    }

    @Scheduled(
            initialDelayString = "${agent.session.cleanup-interval-seconds:300}",
            fixedDelayString = "${agent.session.cleanup-interval-seconds:300}",
            timeUnit = TimeUnit.SECONDS
    )
    public void cleanup() {
        try {
            int timedOut = agentPool.cleanupTimedOutAgents();
            int expired = properties.isEnabled() ? agentPool.cleanupExpiredEntries() : 0;
            if (timedOut > 0 || expired > 0) {
                log.info("[pool] cleanup removed {} timed-out agent(s) and {} expired entr(ies)", timedOut, expired);
            }
        } catch (RuntimeException ex) {
            log.warn("[pool] scheduled cleanup failed: {}", ex.getMessage(), ex);
        }
    }
}
