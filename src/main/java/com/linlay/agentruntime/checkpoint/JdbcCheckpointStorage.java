package com.linlay.agentruntime.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Relational checkpoint storage over a pooled {@link DataSource}. The full checkpoint is kept as JSON in
 * {@code data}; the other columns exist for filtering and ordering.
 */
public class JdbcCheckpointStorage implements CheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStorage.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS checkpoints (
                seq BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id VARCHAR(64) PRIMARY KEY,
                agent_id VARCHAR(255) NOT NULL,
                agent_type VARCHAR(255),
                tenant_id VARCHAR(255),
                status VARCHAR(32) NOT NULL,
                parent_checkpoint_id VARCHAR(64),
                branch_label VARCHAR(255),
                checkpoint_ts BIGINT NOT NULL,
                data TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_agent ON checkpoints (agent_id)",
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_tenant ON checkpoints (tenant_id)",
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_ts ON checkpoints (checkpoint_ts)"
    );

    private static final String COLUMNS = "id, agent_id, agent_type, tenant_id, status, parent_checkpoint_id, branch_label, checkpoint_ts, data";
    private static final String NEWEST_FIRST = " ORDER BY checkpoint_ts DESC, seq DESC";
    private static final String OLDEST_FIRST = " ORDER BY checkpoint_ts ASC, seq ASC";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Checkpoint> checkpointMapper;

    public JdbcCheckpointStorage(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
        this.checkpointMapper = (rs, rowNum) -> readCheckpoint(rs.getString("data"));
        initializeSchema();
    }

    private void initializeSchema() {
        SCHEMA.forEach(jdbcTemplate::execute);
        log.debug("[checkpoint] schema ready on {}", getClass().getSimpleName());
    }

    /**
     * Upsert by id without a transaction; an insert that loses a race to another writer turns into an update.
     */
    @Override
    public String save(Checkpoint checkpoint) {
        String data = writeCheckpoint(checkpoint);
        long ts = toMicros(checkpoint.timestamp());
        if (update(checkpoint, ts, data) > 0) {
            return checkpoint.id();
        }
        try {
            jdbcTemplate.update(
                    "INSERT INTO checkpoints (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    checkpoint.id(),
                    checkpoint.agentId(),
                    checkpoint.agentType(),
                    checkpoint.tenantId(),
                    checkpoint.status().name(),
                    checkpoint.parentCheckpointId(),
                    checkpoint.branchLabel(),
                    ts,
                    data
            );
        } catch (DuplicateKeyException ex) {
            log.debug("[checkpoint] concurrent insert of {}, updating instead", checkpoint.id());
            update(checkpoint, ts, data);
        }
        return checkpoint.id();
    }

    private int update(Checkpoint checkpoint, long ts, String data) {
        return jdbcTemplate.update(
                "UPDATE checkpoints SET agent_id = ?, agent_type = ?, tenant_id = ?, status = ?, "
                        + "parent_checkpoint_id = ?, branch_label = ?, checkpoint_ts = ?, data = ? WHERE id = ?",
                checkpoint.agentId(),
                checkpoint.agentType(),
                checkpoint.tenantId(),
                checkpoint.status().name(),
                checkpoint.parentCheckpointId(),
                checkpoint.branchLabel(),
                ts,
                data,
                checkpoint.id()
        );
    }

    @Override
    public Optional<Checkpoint> get(String checkpointId) {
        List<Checkpoint> rows = jdbcTemplate.query("SELECT data FROM checkpoints WHERE id = ?", checkpointMapper, checkpointId);
        return rows.stream().findFirst();
    }

    @Override
    public boolean delete(String checkpointId) {
        return jdbcTemplate.update("DELETE FROM checkpoints WHERE id = ?", checkpointId) > 0;
    }

    @Override
    public List<CheckpointMetadata> listByAgent(String agentId, int limit, int offset) {
        return jdbcTemplate.query(
                "SELECT data FROM checkpoints WHERE agent_id = ?" + NEWEST_FIRST + " LIMIT ? OFFSET ?",
                checkpointMapper,
                agentId,
                Math.max(0, limit),
                Math.max(0, offset)
        ).stream().map(CheckpointMetadata::from).toList();
    }

    @Override
    public List<CheckpointMetadata> listByTenant(String tenantId, int limit, int offset) {
        return jdbcTemplate.query(
                "SELECT data FROM checkpoints WHERE tenant_id = ?" + NEWEST_FIRST + " LIMIT ? OFFSET ?",
                checkpointMapper,
                tenantId,
                Math.max(0, limit),
                Math.max(0, offset)
        ).stream().map(CheckpointMetadata::from).toList();
    }

    @Override
    public Optional<CheckpointTree> getTree(String agentId) {
        List<Checkpoint> oldestFirst = jdbcTemplate.query(
                "SELECT data FROM checkpoints WHERE agent_id = ?" + OLDEST_FIRST,
                checkpointMapper,
                agentId
        );
        return CheckpointTree.build(oldestFirst);
    }

    @Override
    public Optional<Checkpoint> getLatest(String agentId) {
        List<Checkpoint> rows = jdbcTemplate.query(
                "SELECT data FROM checkpoints WHERE agent_id = ?" + NEWEST_FIRST + " LIMIT 1",
                checkpointMapper,
                agentId
        );
        return rows.stream().findFirst();
    }

    @Override
    public int clearAgent(String agentId) {
        return jdbcTemplate.update("DELETE FROM checkpoints WHERE agent_id = ?", agentId);
    }

    @Override
    public int clearTenant(String tenantId) {
        return jdbcTemplate.update("DELETE FROM checkpoints WHERE tenant_id = ?", tenantId);
    }

    protected JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    private String writeCheckpoint(Checkpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize checkpoint " + checkpoint.id(), ex);
        }
    }

    private Checkpoint readCheckpoint(String data) {
        try {
            return objectMapper.readValue(data, Checkpoint.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot read stored checkpoint", ex);
        }
    }

    private static long toMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }
}
