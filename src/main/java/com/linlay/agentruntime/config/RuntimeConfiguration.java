package com.linlay.agentruntime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.agent.AgentTypeRegistry;
import com.linlay.agentruntime.agent.runtime.AuditLogger;
import com.linlay.agentruntime.agent.runtime.ReactEngine;
import com.linlay.agentruntime.agent.runtime.ReactLoopConfig;
import com.linlay.agentruntime.agent.runtime.ToolDispatcher;
import com.linlay.agentruntime.checkpoint.CheckpointManager;
import com.linlay.agentruntime.checkpoint.CheckpointStorage;
import com.linlay.agentruntime.checkpoint.EmbeddedSqlCheckpointStorage;
import com.linlay.agentruntime.checkpoint.InMemoryCheckpointStorage;
import com.linlay.agentruntime.checkpoint.JdbcCheckpointStorage;
import com.linlay.agentruntime.llm.LlmClient;
import com.linlay.agentruntime.llm.LlmClientRegistry;
import com.linlay.agentruntime.llm.ModelRouter;
import com.linlay.agentruntime.memory.ContextManager;
import com.linlay.agentruntime.pool.AgentPool;
import com.linlay.agentruntime.pool.InMemoryPoolBackend;
import com.linlay.agentruntime.pool.JdbcPoolBackend;
import com.linlay.agentruntime.pool.PoolBackend;
import com.linlay.agentruntime.pool.RedisPoolBackend;
import com.linlay.agentruntime.service.Orchestrator;
import com.linlay.agentruntime.tool.ToolPolicyFilter;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class RuntimeConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReactLoopConfig reactLoopConfig(ReactLoopProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public ContextManager contextManager(ReactLoopConfig config) {
        return new ContextManager(config);
    }

    @Bean
    public ToolPolicyFilter toolPolicyFilter(ToolPolicyProperties properties) {
        return new ToolPolicyFilter(properties);
    }

    @Bean
    public AuditLogger auditLogger(ObjectMapper objectMapper, Clock clock) {
        return new AuditLogger(objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.session", name = "backend", havingValue = "memory", matchIfMissing = true)
    public PoolBackend inMemoryPoolBackend() {
        return new InMemoryPoolBackend();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.session", name = "backend", havingValue = "redis")
    public PoolBackend redisPoolBackend(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, SessionProperties properties) {
        return new RedisPoolBackend(
                redisTemplate,
                objectMapper,
                properties.getKeyPrefix(),
                Duration.ofSeconds(properties.getActiveTtlSeconds()),
                Duration.ofSeconds(properties.getSessionTtlSeconds())
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.session", name = "backend", havingValue = "jdbc")
    public PoolBackend jdbcPoolBackend(DataSource dataSource, ObjectMapper objectMapper, SessionProperties properties, Clock clock) {
        return new JdbcPoolBackend(dataSource, objectMapper, Duration.ofSeconds(properties.getSessionTtlSeconds()), clock);
    }

    @Bean
    public AgentPool agentPool(PoolBackend backend, AgentTypeRegistry typeRegistry, SessionProperties properties, Clock clock) {
        return new AgentPool(backend, typeRegistry, Duration.ofSeconds(properties.getWaitingTimeoutSeconds()), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "backend", havingValue = "memory", matchIfMissing = true)
    public CheckpointStorage inMemoryCheckpointStorage(CheckpointProperties properties) {
        return new InMemoryCheckpointStorage(properties.getMaxCheckpointsPerAgent());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "backend", havingValue = "embedded")
    public CheckpointStorage embeddedCheckpointStorage(CheckpointProperties properties, ObjectMapper objectMapper) {
        return new EmbeddedSqlCheckpointStorage(Path.of(properties.getEmbeddedPath()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "backend", havingValue = "jdbc")
    public CheckpointStorage jdbcCheckpointStorage(DataSource dataSource, ObjectMapper objectMapper) {
        return new JdbcCheckpointStorage(dataSource, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CheckpointManager checkpointManager(CheckpointStorage storage, Clock clock) {
        return new CheckpointManager(storage, clock);
    }

    @Bean
    public ToolDispatcher toolDispatcher(
            ToolRegistry toolRegistry,
            AgentTypeRegistry agentTypeRegistry,
            AgentPool agentPool,
            ToolPolicyFilter toolPolicyFilter,
            AuditLogger auditLogger,
            ObjectProvider<CheckpointManager> checkpointManager,
            ObjectMapper objectMapper,
            ReactLoopConfig config
    ) {
        return new ToolDispatcher(
                toolRegistry,
                agentTypeRegistry,
                agentPool,
                toolPolicyFilter,
                auditLogger,
                checkpointManager.getIfAvailable(),
                objectMapper,
                config
        );
    }

    @Bean
    public ReactEngine reactEngine(
            LlmClient llmClient,
            ObjectProvider<ModelRouter> modelRouter,
            LlmClientRegistry llmClientRegistry,
            ToolDispatcher toolDispatcher,
            ContextManager contextManager,
            ReactLoopConfig config
    ) {
        return new ReactEngine(
                llmClient,
                modelRouter.getIfAvailable(),
                llmClientRegistry,
                toolDispatcher,
                contextManager,
                config
        );
    }

    @Bean
    public Orchestrator orchestrator(
            ReactEngine reactEngine,
            ToolDispatcher toolDispatcher,
            AgentPool agentPool,
            ObjectProvider<CheckpointManager> checkpointManager,
            AuditLogger auditLogger,
            ReactLoopProperties reactProperties,
            SessionProperties sessionProperties
    ) {
        return new Orchestrator(
                reactEngine,
                toolDispatcher,
                agentPool,
                checkpointManager.getIfAvailable(),
                auditLogger,
                reactProperties.getSystemPrompt(),
                sessionProperties.isEnabled() && sessionProperties.isLazyRestore()
        );
    }
}
