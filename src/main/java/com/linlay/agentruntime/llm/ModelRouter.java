package com.linlay.agentruntime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a request's complexity with a small classifier model and maps the score to a provider name.
 */
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    public static final int DEFAULT_HISTORY_TURNS = 4;

    static final String CLASSIFIER_SYSTEM_PROMPT = """
            You are a task complexity classifier for an assistant that works with email, calendars, \
            travel, todos and similar personal services.

            Score the user's latest request from 1 to 100 by the work it actually needs:
            1-20   greetings, small talk, one-line factual questions
            21-50  one clear action handled by a single agent with a few tool calls
            51-80  requests spanning several services, investigation, or planning before acting
            81-100 long multi-step workflows, strategic planning, large batch operations

            A follow-up to a task already in progress scores lower. When unsure, round up.

            Respond with a JSON object only:
            {"reasoning": "<short explanation>", "score": <integer 1-100>}
            """;

    private final LlmClientRegistry registry;
    private final ObjectMapper objectMapper;
    private final String classifierProvider;
    private final String defaultProvider;
    private final List<RoutingRule> rules;
    private final int historyTurns;

    public ModelRouter(
            LlmClientRegistry registry,
            ObjectMapper objectMapper,
            String classifierProvider,
            String defaultProvider,
            List<RoutingRule> rules,
            int historyTurns
    ) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.classifierProvider = StringUtils.hasText(classifierProvider) ? classifierProvider.trim() : "fast";
        this.defaultProvider = StringUtils.hasText(defaultProvider) ? defaultProvider.trim() : "fast";
        this.rules = rules == null || rules.isEmpty() ? RoutingRule.DEFAULTS : List.copyOf(rules);
        this.historyTurns = historyTurns > 0 ? historyTurns : DEFAULT_HISTORY_TURNS;
    }

    public RoutingDecision route(List<Message> messages) {
        long start = System.nanoTime();
        try {
            LlmClient classifier = registry.find(classifierProvider)
                    .orElseThrow(() -> new IllegalStateException(
                            "Classifier provider '" + classifierProvider + "' is not registered"));

            List<Message> classifierMessages = new ArrayList<>();
            classifierMessages.add(new SystemMessage(CLASSIFIER_SYSTEM_PROMPT));
            classifierMessages.addAll(recentTurns(messages));

            ChatCompletion completion = classifier.chatComplete(classifierMessages, List.of());
            Classification classification = parse(completion.content());

            String provider = defaultProvider;
            for (RoutingRule rule : rules) {
                if (rule.matches(classification.score())) {
                    provider = rule.provider();
                    break;
                }
            }
            if (!registry.contains(provider)) {
                log.warn("[router] provider '{}' is not registered, falling back to '{}'", provider, defaultProvider);
                provider = defaultProvider;
            }
            long elapsed = elapsedMs(start);
            log.info("[router] score={} -> {} ({}ms) | {}", classification.score(), provider, elapsed, classification.reasoning());
            return new RoutingDecision(provider, classification.score(), classification.reasoning(), elapsed);
        } catch (RuntimeException ex) {
            long elapsed = elapsedMs(start);
            log.warn("[router] classification failed ({}), falling back to '{}'", ex.getMessage(), defaultProvider);
            return new RoutingDecision(defaultProvider, -1, "fallback: " + ex.getMessage(), elapsed);
        }
    }

    public String defaultProvider() {
        return defaultProvider;
    }

    private List<Message> recentTurns(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<Message> conversational = new ArrayList<>();
        for (Message message : messages) {
            if (message instanceof UserMessage) {
                conversational.add(message);
            } else if (message instanceof AssistantMessage assistant && !assistant.hasToolCalls()) {
                conversational.add(message);
            }
        }
        int from = Math.max(0, conversational.size() - historyTurns);
        return conversational.subList(from, conversational.size());
    }

    Classification parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        Classification direct = tryParse(text);
        if (direct != null) {
            return direct;
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            Classification embedded = tryParse(text.substring(open, close + 1));
            if (embedded != null) {
                return embedded;
            }
        }
        throw new IllegalArgumentException("Could not parse classifier response: " + text);
    }

    private Classification tryParse(String json) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject() || !node.has("score")) {
                return null;
            }
            JsonNode score = node.get("score");
            int value;
            if (score.isNumber()) {
                value = score.asInt();
            } else if (score.isTextual() && score.asText().trim().matches("-?\\d+")) {
                value = Integer.parseInt(score.asText().trim());
            } else {
                return null;
            }
            return new Classification(value, node.path("reasoning").asText(""));
        } catch (JsonProcessingException ex) {
            log.debug("[router] classifier output is not plain JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    record Classification(int score, String reasoning) {
    }
}
