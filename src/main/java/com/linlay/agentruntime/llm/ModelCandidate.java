package com.linlay.agentruntime.llm;

import org.springframework.util.StringUtils;

public record ModelCandidate(
        String provider,
        String model,
        String apiKeyId,
        LlmClient client
) {

    public ModelCandidate {
        if (!StringUtils.hasText(provider)) {
            throw new IllegalArgumentException("candidate provider must not be blank");
        }
        if (client == null) {
            throw new IllegalArgumentException("candidate client must not be null for " + provider);
        }
        provider = provider.trim();
        model = model == null ? "" : model.trim();
        apiKeyId = StringUtils.hasText(apiKeyId) ? apiKeyId.trim() : null;
    }

    public ModelCandidate(String provider, String model, LlmClient client) {
        this(provider, model, null, client);
    }

    public String key() {
        String base = provider + ":" + model;
        return apiKeyId == null ? base : base + ":" + apiKeyId;
    }
}
