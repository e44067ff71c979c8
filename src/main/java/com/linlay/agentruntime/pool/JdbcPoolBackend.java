package com.linlay.agentruntime.pool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Relational pool storage. Expiry is an {@code expires_at} column checked on every read;
 * {@link #cleanupExpired()} deletes rows past it.
 */
public class JdbcPoolBackend implements PoolBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcPoolBackend.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS agent_sessions (
                tenant_id VARCHAR(255) NOT NULL,
                agent_id VARCHAR(255) NOT NULL,
                agent_type VARCHAR(255) NOT NULL,
                data TEXT NOT NULL,
                expires_at BIGINT NOT NULL,
                created_at BIGINT NOT NULL,
                updated_at BIGINT NOT NULL,
                PRIMARY KEY (tenant_id, agent_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_agent_sessions_expires ON agent_sessions (expires_at)"
    );

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Duration sessionTtl;
    private final Clock clock;
    private final RowMapper<PoolEntry> entryMapper;

    public JdbcPoolBackend(DataSource dataSource, ObjectMapper objectMapper, Duration sessionTtl, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
        this.sessionTtl = sessionTtl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.entryMapper = (rs, rowNum) -> read(rs.getString("data"));
        SCHEMA.forEach(jdbcTemplate::execute);
    }

    /**
     * Upsert without a transaction: update, insert when no row exists, and update again when another writer
     * inserted the row first.
     */
    @Override
    public void saveAgent(PoolEntry entry) {
        String data = write(entry);
        long now = clock.millis();
        long expiresAt = now + sessionTtl.toMillis();
        if (updateAgent(entry, data, expiresAt, now) > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                    "INSERT INTO agent_sessions (tenant_id, agent_id, agent_type, data, expires_at, created_at, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    entry.tenantId(), entry.agentId(), entry.agentType(), data, expiresAt, now, now
            );
        } catch (DuplicateKeyException ex) {
            log.debug("[pool] concurrent insert of {}/{}, updating instead", entry.tenantId(), entry.agentId());
            updateAgent(entry, data, expiresAt, now);
        }
    }

    private int updateAgent(PoolEntry entry, String data, long expiresAt, long now) {
        return jdbcTemplate.update(
                "UPDATE agent_sessions SET agent_type = ?, data = ?, expires_at = ?, updated_at = ? "
                        + "WHERE tenant_id = ? AND agent_id = ?",
                entry.agentType(), data, expiresAt, now, entry.tenantId(), entry.agentId()
        );
    }

    @Override
    public Optional<PoolEntry> getAgent(String tenantId, String agentId) {
        return jdbcTemplate.query(
                "SELECT data FROM agent_sessions WHERE tenant_id = ? AND agent_id = ? AND expires_at > ?",
                entryMapper,
                tenantId, agentId, clock.millis()
        ).stream().findFirst();
    }

    @Override
    public List<PoolEntry> listAgents(String tenantId) {
        return jdbcTemplate.query(
                "SELECT data FROM agent_sessions WHERE tenant_id = ? AND expires_at > ? ORDER BY created_at, agent_id",
                entryMapper,
                tenantId, clock.millis()
        );
    }

    @Override
    public boolean removeAgent(String tenantId, String agentId) {
        return jdbcTemplate.update("DELETE FROM agent_sessions WHERE tenant_id = ? AND agent_id = ?", tenantId, agentId) > 0;
    }

    @Override
    public int clearTenant(String tenantId) {
        return jdbcTemplate.update("DELETE FROM agent_sessions WHERE tenant_id = ?", tenantId);
    }

    @Override
    public Set<String> getActiveTenants() {
        return new LinkedHashSet<>(jdbcTemplate.queryForList(
                "SELECT DISTINCT tenant_id FROM agent_sessions WHERE expires_at > ? ORDER BY tenant_id",
                String.class,
                clock.millis()
        ));
    }

    @Override
    public int cleanupExpired() {
        int removed = jdbcTemplate.update("DELETE FROM agent_sessions WHERE expires_at <= ?", clock.millis());
        if (removed > 0) {
            log.info("[pool] removed {} expired session row(s)", removed);
        }
        return removed;
    }

    private String write(PoolEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize pool entry " + entry.agentId(), ex);
        }
    }

    private PoolEntry read(String json) {
        try {
            return objectMapper.readValue(json, PoolEntry.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot read stored pool entry", ex);
        }
    }
}
