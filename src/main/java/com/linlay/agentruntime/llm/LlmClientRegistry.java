package com.linlay.agentruntime.llm;

import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named model clients. Names are the provider keys used by routing rules and candidate lists.
 */
public class LlmClientRegistry {

    private final Object registerLock = new Object();
    private volatile Map<String, LlmClient> clients = Map.of();

    public void register(String name, LlmClient client) {
        if (!StringUtils.hasText(name) || client == null) {
            throw new IllegalArgumentException("client name and client are required");
        }
        synchronized (registerLock) {
            Map<String, LlmClient> updated = new LinkedHashMap<>(clients);
            updated.put(name.trim(), client);
            clients = Map.copyOf(updated);
        }
    }

    public Optional<LlmClient> find(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(name.trim()));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Set<String> names() {
        return clients.keySet();
    }
}
