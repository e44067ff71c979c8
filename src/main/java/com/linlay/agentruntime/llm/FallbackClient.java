package com.linlay.agentruntime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tries an ordered list of model candidates, skipping any in cooldown. A failing candidate is put in
 * cooldown for {@code min(base * multiplier^errorCount, max)}; a success clears its state. A context
 * overflow belongs to the request, not the candidate, so it does not start a cooldown.
 */
public class FallbackClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(FallbackClient.class);
    private static final Pattern STATUS_CODE = Pattern.compile("\\b([45]\\d{2})\\b");

    private final List<ModelCandidate> candidates;
    private final CooldownPolicy cooldownPolicy;
    private final Clock clock;
    private final Map<String, Instant> cooldownUntil = new ConcurrentHashMap<>();
    private final Map<String, Integer> errorCounts = new ConcurrentHashMap<>();

    public FallbackClient(List<ModelCandidate> candidates) {
        this(candidates, CooldownPolicy.DEFAULT, Clock.systemUTC());
    }

    public FallbackClient(List<ModelCandidate> candidates, CooldownPolicy cooldownPolicy, Clock clock) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one model candidate is required");
        }
        this.candidates = List.copyOf(candidates);
        this.cooldownPolicy = cooldownPolicy == null ? CooldownPolicy.DEFAULT : cooldownPolicy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public ChatCompletion chatComplete(List<Message> messages, List<ToolSchema> tools) {
        return complete(messages, tools, true);
    }

    /**
     * Walks the chain again without skipping cooled-down candidates. Failures still extend their cooldown.
     */
    @Override
    public ChatCompletion retryComplete(List<Message> messages, List<ToolSchema> tools) {
        return complete(messages, tools, false);
    }

    private ChatCompletion complete(List<Message> messages, List<ToolSchema> tools, boolean skipCooldown) {
        List<FallbackAttempt> attempts = new ArrayList<>();
        for (ModelCandidate candidate : candidates) {
            String key = candidate.key();
            if (skipCooldown && isInCooldown(key)) {
                log.debug("[fallback] skip {} (cooldown until {})", key, cooldownUntil.get(key));
                attempts.add(new FallbackAttempt(
                        candidate.provider(),
                        candidate.model(),
                        "candidate in cooldown",
                        FailoverReason.COOLDOWN,
                        null
                ));
                continue;
            }
            try {
                ChatCompletion completion = candidate.client().chatComplete(messages, tools);
                markSuccess(key);
                if (!attempts.isEmpty()) {
                    log.info("[fallback] {} succeeded after {} failed attempt(s)", key, attempts.size());
                }
                return completion;
            } catch (RuntimeException ex) {
                FailoverReason reason = FailoverReason.classify(ex);
                Integer statusCode = extractStatusCode(ex);
                log.warn("[fallback] {} failed reason={} status={}: {}", key, reason.wireValue(), statusCode, ex.getMessage());
                attempts.add(new FallbackAttempt(
                        candidate.provider(),
                        candidate.model(),
                        String.valueOf(ex.getMessage()),
                        reason,
                        statusCode
                ));
                if (FailoverReason.isContextOverflow(ex.getMessage())) {
                    log.debug("[fallback] {} rejected the prompt size, no cooldown", key);
                } else {
                    markCooldown(key, reason);
                }
            }
        }
        throw new AllCandidatesExhaustedException(attempts);
    }

    public List<ModelCandidate> candidates() {
        return candidates;
    }

    public boolean isInCooldown(String key) {
        Instant until = cooldownUntil.get(key);
        if (until == null) {
            return false;
        }
        if (!clock.instant().isBefore(until)) {
            cooldownUntil.remove(key, until);
            return false;
        }
        return true;
    }

    public Optional<Instant> cooldownUntil(String key) {
        return Optional.ofNullable(cooldownUntil.get(key));
    }

    public int errorCount(String key) {
        return errorCounts.getOrDefault(key, 0);
    }

    public void resetCooldowns() {
        cooldownUntil.clear();
        errorCounts.clear();
    }

    private void markCooldown(String key, FailoverReason reason) {
        int count = errorCounts.getOrDefault(key, 0);
        Duration cooldown = cooldownPolicy.cooldownFor(count);
        cooldownUntil.put(key, clock.instant().plus(cooldown));
        errorCounts.put(key, count + 1);
        log.info("[fallback] {} in cooldown for {}s (reason={}, errorCount={})",
                key, cooldown.toSeconds(), reason.wireValue(), count + 1);
    }

    private void markSuccess(String key) {
        errorCounts.remove(key);
        cooldownUntil.remove(key);
    }

    static Integer extractStatusCode(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RestClientResponseException http) {
                return http.getStatusCode().value();
            }
            if (current.getMessage() != null) {
                Matcher matcher = STATUS_CODE.matcher(current.getMessage());
                if (matcher.find()) {
                    return Integer.parseInt(matcher.group(1));
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
