package com.linlay.agentruntime.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Single-file H2 database owned by this storage. Suited to one process; use {@link JdbcCheckpointStorage}
 * over a shared pool when several processes write checkpoints.
 */
public class EmbeddedSqlCheckpointStorage extends JdbcCheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedSqlCheckpointStorage.class);

    private final Path databaseFile;

    public EmbeddedSqlCheckpointStorage(Path databaseFile, ObjectMapper objectMapper) {
        super(openDataSource(databaseFile), objectMapper);
        this.databaseFile = databaseFile;
        log.info("[checkpoint] embedded database at {}", databaseFile.toAbsolutePath());
    }

    public Path databaseFile() {
        return databaseFile;
    }

    @Override
    public void close() {
        jdbcTemplate().execute("SHUTDOWN");
        log.debug("[checkpoint] embedded database {} shut down", databaseFile);
    }

    private static DriverManagerDataSource openDataSource(Path databaseFile) {
        Path absolute = databaseFile.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException ex) {
                throw new IllegalStateException("Cannot create checkpoint directory " + parent, ex);
            }
        }
        return new DriverManagerDataSource("jdbc:h2:file:" + absolute + ";DB_CLOSE_DELAY=-1", "sa", "");
    }
}
