package com.linlay.agentruntime.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model providers, the failover order across them and the complexity router.
 */
@Validated
@ConfigurationProperties(prefix = "agent.llm")
public class LlmProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    /**
     * Provider keys tried in order by the fallback client. Empty means every provider in declaration order.
     */
    private List<String> candidates = new ArrayList<>();
    @Valid
    private Cooldown cooldown = new Cooldown();
    @Valid
    private Router router = new Router();

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public ProviderConfig getProvider(String key) {
        return providers.get(key);
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<String> candidates) {
        this.candidates = candidates == null ? new ArrayList<>() : candidates;
    }

    public Cooldown getCooldown() {
        return cooldown;
    }

    public void setCooldown(Cooldown cooldown) {
        this.cooldown = cooldown == null ? new Cooldown() : cooldown;
    }

    public Router getRouter() {
        return router;
    }

    public void setRouter(Router router) {
        this.router = router == null ? new Router() : router;
    }

    public static class ProviderConfig {
        private String baseUrl;
        private String apiKey;
        private String apiKeyId;
        private String model;
        private Double temperature;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyId() {
            return apiKeyId;
        }

        public void setApiKeyId(String apiKeyId) {
            this.apiKeyId = apiKeyId;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Cooldown {
        @Min(0)
        private long baseSeconds = 60;
        private double multiplier = 5.0;
        @Min(1)
        private long maxSeconds = 3600;

        public long getBaseSeconds() {
            return baseSeconds;
        }

        public void setBaseSeconds(long baseSeconds) {
            this.baseSeconds = baseSeconds;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxSeconds() {
            return maxSeconds;
        }

        public void setMaxSeconds(long maxSeconds) {
            this.maxSeconds = maxSeconds;
        }
    }

    public static class Router {
        private boolean enabled = false;
        private String classifierProvider = "fast";
        private String defaultProvider = "fast";
        @Min(1)
        private int historyTurns = 4;
        private List<Rule> rules = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getClassifierProvider() {
            return classifierProvider;
        }

        public void setClassifierProvider(String classifierProvider) {
            this.classifierProvider = classifierProvider;
        }

        public String getDefaultProvider() {
            return defaultProvider;
        }

        public void setDefaultProvider(String defaultProvider) {
            this.defaultProvider = defaultProvider;
        }

        public int getHistoryTurns() {
            return historyTurns;
        }

        public void setHistoryTurns(int historyTurns) {
            this.historyTurns = historyTurns;
        }

        public List<Rule> getRules() {
            return rules;
        }

        public void setRules(List<Rule> rules) {
            this.rules = rules == null ? new ArrayList<>() : rules;
        }
    }

    public static class Rule {
        private int minScore;
        private int maxScore;
        private String provider;

        public int getMinScore() {
            return minScore;
        }

        public void setMinScore(int minScore) {
            this.minScore = minScore;
        }

        public int getMaxScore() {
            return maxScore;
        }

        public void setMaxScore(int maxScore) {
            this.maxScore = maxScore;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }
    }
}
