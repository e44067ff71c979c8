package com.linlay.agentruntime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.llm.ChatModelLlmClient;
import com.linlay.agentruntime.llm.CooldownPolicy;
import com.linlay.agentruntime.llm.FallbackClient;
import com.linlay.agentruntime.llm.LlmClient;
import com.linlay.agentruntime.llm.LlmClientRegistry;
import com.linlay.agentruntime.llm.ModelCandidate;
import com.linlay.agentruntime.llm.ModelRouter;
import com.linlay.agentruntime.llm.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one OpenAI-compatible client per configured provider, a failover client over the candidate order,
 * and, when routing is on, a failover client per provider that starts with that provider.
 */
@Configuration
public class LlmConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LlmConfiguration.class);

    @Bean
    public ProviderClients providerClients(LlmProperties properties, ObjectMapper objectMapper) {
        Map<String, ModelCandidate> candidates = new LinkedHashMap<>();
        for (var entry : properties.getProviders().entrySet()) {
            String key = entry.getKey();
            LlmProperties.ProviderConfig config = entry.getValue();
            if (!StringUtils.hasText(key) || config == null) {
                log.warn("[llm] skip invalid provider config entry: key='{}'", key);
                continue;
            }
            try {
                ChatModel model = buildChatModel(key, config);
                LlmClient client = new ChatModelLlmClient(model, objectMapper);
                candidates.put(key, new ModelCandidate(key, config.getModel(), config.getApiKeyId(), client));
                log.info("[llm] registered provider '{}' model={}", key, config.getModel());
            } catch (RuntimeException ex) {
                log.warn("[llm] failed to create client for provider '{}': {}", key, ex.getMessage());
            }
        }
        return new ProviderClients(candidates, candidateOrder(properties, candidates));
    }

    @Bean
    public LlmClient llmClient(ProviderClients providerClients, LlmProperties properties, Clock clock) {
        if (providerClients.ordered().isEmpty()) {
            log.warn("[llm] no model providers configured; model calls will fail until agent.llm.providers is set");
            return (messages, tools) -> {
                throw new IllegalStateException("No model providers configured");
            };
        }
        return new FallbackClient(providerClients.ordered(), cooldownPolicy(properties), clock);
    }

    @Bean
    public LlmClientRegistry llmClientRegistry(ProviderClients providerClients, LlmProperties properties, Clock clock) {
        LlmClientRegistry registry = new LlmClientRegistry();
        List<ModelCandidate> ordered = providerClients.ordered();
        for (ModelCandidate primary : providerClients.byName().values()) {
            List<ModelCandidate> chain = new ArrayList<>();
            chain.add(primary);
            ordered.stream().filter(candidate -> candidate != primary).forEach(chain::add);
            registry.register(primary.provider(), new FallbackClient(chain, cooldownPolicy(properties), clock));
        }
        return registry;
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.llm.router", name = "enabled", havingValue = "true")
    public ModelRouter modelRouter(LlmClientRegistry registry, LlmProperties properties, ObjectMapper objectMapper) {
        LlmProperties.Router router = properties.getRouter();
        List<RoutingRule> rules = router.getRules().stream()
                .map(rule -> new RoutingRule(rule.getMinScore(), rule.getMaxScore(), rule.getProvider()))
                .toList();
        return new ModelRouter(
                registry,
                objectMapper,
                router.getClassifierProvider(),
                router.getDefaultProvider(),
                rules,
                router.getHistoryTurns()
        );
    }

    private static CooldownPolicy cooldownPolicy(LlmProperties properties) {
        LlmProperties.Cooldown cooldown = properties.getCooldown();
        return new CooldownPolicy(
                Duration.ofSeconds(cooldown.getBaseSeconds()),
                cooldown.getMultiplier(),
                Duration.ofSeconds(cooldown.getMaxSeconds())
        );
    }

    private static List<ModelCandidate> candidateOrder(LlmProperties properties, Map<String, ModelCandidate> candidates) {
        if (properties.getCandidates().isEmpty()) {
            return List.copyOf(candidates.values());
        }
        List<ModelCandidate> ordered = new ArrayList<>();
        for (String key : properties.getCandidates()) {
            ModelCandidate candidate = candidates.get(key);
            if (candidate == null) {
                log.warn("[llm] candidate '{}' has no usable provider config, skipping", key);
                continue;
            }
            ordered.add(candidate);
        }
        return ordered;
    }

    private static ChatModel buildChatModel(String providerName, LlmProperties.ProviderConfig config) {
        assertProviderConfig(providerName, config);
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(config.getBaseUrl())
                .apiKey(config.getApiKey())
                .build();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(config.getModel())
                .temperature(config.getTemperature() == null ? 0.2 : config.getTemperature())
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();
    }

    private static void assertProviderConfig(String providerName, LlmProperties.ProviderConfig config) {
        if (!StringUtils.hasText(config.getBaseUrl())) {
            throw new IllegalStateException("Missing base-url for provider '" + providerName + "'");
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            throw new IllegalStateException("Missing api-key for provider '" + providerName + "'");
        }
        if (!StringUtils.hasText(config.getModel())) {
            throw new IllegalStateException("Missing model for provider '" + providerName + "'");
        }
    }

    /**
     * Usable providers by name, plus the failover order.
     */
    public record ProviderClients(Map<String, ModelCandidate> byName, List<ModelCandidate> ordered) {
    }
}
