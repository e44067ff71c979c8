package com.linlay.agentruntime.pool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed pool storage with two namespaces:
 * <ul>
 *     <li>{@code {prefix}:active:{tenant}:{agent}} short TTL, refreshed on every save,</li>
 *     <li>{@code {prefix}:session:{tenant}:{agent}} long TTL, survives idle periods and restarts.</li>
 * </ul>
 * A per-tenant set indexes agent ids and {@code {prefix}:tenants} indexes tenants.
 */
public class RedisPoolBackend implements PoolBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisPoolBackend.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration activeTtl;
    private final Duration sessionTtl;

    public RedisPoolBackend(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            String keyPrefix,
            Duration activeTtl,
            Duration sessionTtl
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "agent-runtime" : keyPrefix.trim();
        this.activeTtl = activeTtl;
        this.sessionTtl = sessionTtl;
    }

    @Override
    public void saveAgent(PoolEntry entry) {
        String json = write(entry);
        redisTemplate.opsForValue().set(activeKey(entry.tenantId(), entry.agentId()), json, activeTtl);
        redisTemplate.opsForValue().set(sessionKey(entry.tenantId(), entry.agentId()), json, sessionTtl);
        String indexKey = indexKey(entry.tenantId());
        redisTemplate.opsForSet().add(indexKey, entry.agentId());
        redisTemplate.expire(indexKey, sessionTtl);
        redisTemplate.opsForSet().add(tenantsKey(), entry.tenantId());
        log.debug("[pool] redis saved {}/{}", entry.tenantId(), entry.agentId());
    }

    @Override
    public Optional<PoolEntry> getAgent(String tenantId, String agentId) {
        String json = redisTemplate.opsForValue().get(activeKey(tenantId, agentId));
        if (json == null) {
            json = redisTemplate.opsForValue().get(sessionKey(tenantId, agentId));
        }
        return json == null ? Optional.empty() : Optional.of(read(json));
    }

    @Override
    public List<PoolEntry> listAgents(String tenantId) {
        Set<String> agentIds = redisTemplate.opsForSet().members(indexKey(tenantId));
        if (agentIds == null || agentIds.isEmpty()) {
            return List.of();
        }
        List<PoolEntry> entries = new ArrayList<>();
        for (String agentId : agentIds) {
            Optional<PoolEntry> entry = getAgent(tenantId, agentId);
            if (entry.isPresent()) {
                entries.add(entry.get());
            } else {
                // both copies expired
                redisTemplate.opsForSet().remove(indexKey(tenantId), agentId);
            }
        }
        return entries;
    }

    @Override
    public boolean removeAgent(String tenantId, String agentId) {
        Long deleted = redisTemplate.delete(List.of(activeKey(tenantId, agentId), sessionKey(tenantId, agentId)));
        redisTemplate.opsForSet().remove(indexKey(tenantId), agentId);
        Long remaining = redisTemplate.opsForSet().size(indexKey(tenantId));
        if (remaining == null || remaining == 0) {
            redisTemplate.opsForSet().remove(tenantsKey(), tenantId);
        }
        return deleted != null && deleted > 0;
    }

    @Override
    public int clearTenant(String tenantId) {
        Set<String> agentIds = redisTemplate.opsForSet().members(indexKey(tenantId));
        int count = 0;
        if (agentIds != null) {
            List<String> keys = new ArrayList<>();
            for (String agentId : agentIds) {
                keys.add(activeKey(tenantId, agentId));
                keys.add(sessionKey(tenantId, agentId));
            }
            if (!keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
            count = agentIds.size();
        }
        redisTemplate.delete(indexKey(tenantId));
        redisTemplate.opsForSet().remove(tenantsKey(), tenantId);
        return count;
    }

    @Override
    public Set<String> getActiveTenants() {
        Set<String> tenants = redisTemplate.opsForSet().members(tenantsKey());
        if (tenants == null || tenants.isEmpty()) {
            return Set.of();
        }
        Set<String> active = new LinkedHashSet<>();
        for (String tenant : tenants) {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(indexKey(tenant)))) {
                active.add(tenant);
            } else {
                redisTemplate.opsForSet().remove(tenantsKey(), tenant);
            }
        }
        return active;
    }

    String activeKey(String tenantId, String agentId) {
        return keyPrefix + ":active:" + tenantId + ":" + agentId;
    }

    String sessionKey(String tenantId, String agentId) {
        return keyPrefix + ":session:" + tenantId + ":" + agentId;
    }

    String indexKey(String tenantId) {
        return keyPrefix + ":agents:" + tenantId;
    }

    String tenantsKey() {
        return keyPrefix + ":tenants";
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
            throw new IllegalStateException("Cannot read pool entry from redis", ex);
        }
    }
}
