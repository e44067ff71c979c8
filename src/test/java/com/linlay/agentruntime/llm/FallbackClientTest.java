package com.linlay.agentruntime.llm;

import com.linlay.agentruntime.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackClientTest {

    private static final List<Message> MESSAGES = List.of(new UserMessage("hello"));

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
    private final CooldownPolicy policy = new CooldownPolicy(Duration.ofSeconds(60), 5.0, Duration.ofSeconds(3600));

    @Test
    void firstHealthyCandidateShouldAnswer() {
        AtomicInteger secondaryCalls = new AtomicInteger();
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("primary", "model-a", (messages, tools) -> ChatCompletion.text("from primary")),
                new ModelCandidate("secondary", "model-b", (messages, tools) -> {
                    secondaryCalls.incrementAndGet();
                    return ChatCompletion.text("from secondary");
                })
        ), policy, clock);

        assertThat(client.chatComplete(MESSAGES, List.of()).content()).isEqualTo("from primary");
        assertThat(secondaryCalls).hasValue(0);
    }

    @Test
    void failingCandidateShouldBeCooledDownAndSkipped() {
        AtomicInteger primaryCalls = new AtomicInteger();
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("primary", "model-a", (messages, tools) -> {
                    primaryCalls.incrementAndGet();
                    throw new IllegalStateException("429 Too Many Requests");
                }),
                new ModelCandidate("secondary", "model-b", (messages, tools) -> ChatCompletion.text("from secondary"))
        ), policy, clock);

        assertThat(client.chatComplete(MESSAGES, List.of()).content()).isEqualTo("from secondary");
        assertThat(client.isInCooldown("primary:model-a")).isTrue();
        assertThat(client.cooldownUntil("primary:model-a")).contains(clock.instant().plusSeconds(60));
        assertThat(client.errorCount("primary:model-a")).isEqualTo(1);

        client.chatComplete(MESSAGES, List.of());
        assertThat(primaryCalls).hasValue(1);

        clock.advance(Duration.ofSeconds(61));
        client.chatComplete(MESSAGES, List.of());
        assertThat(primaryCalls).hasValue(2);
        assertThat(client.cooldownUntil("primary:model-a")).contains(clock.instant().plusSeconds(300));
    }

    @Test
    void successShouldClearCooldownState() {
        AtomicInteger calls = new AtomicInteger();
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("flaky", "model-a", (messages, tools) -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("request timed out");
                    }
                    return ChatCompletion.text("ok");
                }),
                new ModelCandidate("backup", "model-b", (messages, tools) -> ChatCompletion.text("backup"))
        ), policy, clock);

        client.chatComplete(MESSAGES, List.of());
        clock.advance(Duration.ofMinutes(2));

        assertThat(client.chatComplete(MESSAGES, List.of()).content()).isEqualTo("ok");
        assertThat(client.errorCount("flaky:model-a")).isZero();
        assertThat(client.cooldownUntil("flaky:model-a")).isEmpty();
    }

    @Test
    void exhaustionShouldListEveryAttemptWithItsReason() {
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("one", "model-a", (messages, tools) -> {
                    throw new IllegalStateException("401 Unauthorized");
                }),
                new ModelCandidate("two", "model-b", (messages, tools) -> {
                    throw new IllegalStateException("upstream exploded");
                })
        ), policy, clock);

        assertThatThrownBy(() -> client.chatComplete(MESSAGES, List.of()))
                .isInstanceOfSatisfying(AllCandidatesExhaustedException.class, ex -> {
                    assertThat(ex.attempts()).extracting(FallbackAttempt::reason)
                            .containsExactly(FailoverReason.AUTH, FailoverReason.UNKNOWN);
                    assertThat(ex.attempts().get(0).statusCode()).isEqualTo(401);
                    assertThat(ex.getMessage()).contains("one/model-a=auth", "two/model-b=unknown");
                });

        assertThatThrownBy(() -> client.chatComplete(MESSAGES, List.of()))
                .isInstanceOfSatisfying(AllCandidatesExhaustedException.class, ex ->
                        assertThat(ex.attempts()).extracting(FallbackAttempt::reason)
                                .containsOnly(FailoverReason.COOLDOWN));
    }

    @Test
    void candidatesSharingAProviderShouldCoolDownPerApiKey() {
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("openai", "gpt", "key-1", (messages, tools) -> {
                    throw new IllegalStateException("402 insufficient credits");
                }),
                new ModelCandidate("openai", "gpt", "key-2", (messages, tools) -> ChatCompletion.text("second key"))
        ), policy, clock);

        assertThat(client.chatComplete(MESSAGES, List.of()).content()).isEqualTo("second key");
        assertThat(client.isInCooldown("openai:gpt:key-1")).isTrue();
        assertThat(client.isInCooldown("openai:gpt:key-2")).isFalse();
    }

    @Test
    void contextOverflowShouldNotCoolTheCandidateDown() {
        AtomicInteger calls = new AtomicInteger();
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("openai", "gpt", (messages, tools) -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("400 This model's maximum context length is 8192 tokens");
                    }
                    return ChatCompletion.text("shorter prompt fits");
                })
        ), policy, clock);

        assertThatThrownBy(() -> client.chatComplete(MESSAGES, List.of()))
                .isInstanceOfSatisfying(AllCandidatesExhaustedException.class, ex ->
                        assertThat(ex.attempts().get(0).reason()).isEqualTo(FailoverReason.FORMAT));
        assertThat(client.isInCooldown("openai:gpt")).isFalse();
        assertThat(client.errorCount("openai:gpt")).isZero();

        assertThat(client.chatComplete(MESSAGES, List.of()).content()).isEqualTo("shorter prompt fits");
    }

    @Test
    void retryShouldReachCandidatesInCooldown() {
        AtomicInteger calls = new AtomicInteger();
        FallbackClient client = new FallbackClient(List.of(
                new ModelCandidate("openai", "gpt", (messages, tools) -> {
                    if (calls.incrementAndGet() <= 2) {
                        throw new IllegalStateException("429 Too Many Requests");
                    }
                    return ChatCompletion.text("recovered");
                })
        ), policy, clock);

        assertThatThrownBy(() -> client.chatComplete(MESSAGES, List.of()))
                .isInstanceOf(AllCandidatesExhaustedException.class);
        assertThatThrownBy(() -> client.chatComplete(MESSAGES, List.of()))
                .isInstanceOfSatisfying(AllCandidatesExhaustedException.class, ex ->
                        assertThat(ex.attempts()).extracting(FallbackAttempt::reason)
                                .containsExactly(FailoverReason.COOLDOWN));
        assertThat(calls).hasValue(1);

        assertThatThrownBy(() -> client.retryComplete(MESSAGES, List.of()))
                .isInstanceOfSatisfying(AllCandidatesExhaustedException.class, ex ->
                        assertThat(ex.attempts()).extracting(FallbackAttempt::reason)
                                .containsExactly(FailoverReason.RATE_LIMIT));
        assertThat(client.errorCount("openai:gpt")).isEqualTo(2);
        assertThat(client.cooldownUntil("openai:gpt")).contains(clock.instant().plusSeconds(300));

        assertThat(client.retryComplete(MESSAGES, List.of()).content()).isEqualTo("recovered");
        assertThat(client.isInCooldown("openai:gpt")).isFalse();
    }

    @Test
    void cooldownShouldGrowGeometricallyUpToTheCap() {
        assertThat(policy.cooldownFor(0)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.cooldownFor(1)).isEqualTo(Duration.ofSeconds(300));
        assertThat(policy.cooldownFor(2)).isEqualTo(Duration.ofSeconds(1500));
        assertThat(policy.cooldownFor(3)).isEqualTo(Duration.ofSeconds(3600));
    }

    @Test
    void emptyCandidateListShouldBeRejected() {
        assertThatThrownBy(() -> new FallbackClient(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
