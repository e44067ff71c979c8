package com.linlay.agentruntime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ModelRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void scoreShouldSelectProviderByRule() {
        LlmClientRegistry registry = registry("{\"reasoning\": \"multi-service planning\", \"score\": 75}");
        ModelRouter router = new ModelRouter(registry, objectMapper, "fast", "fast", List.of(), 4);

        RoutingDecision decision = router.route(List.of(new UserMessage("plan my trip and email my team")));

        assertThat(decision.provider()).isEqualTo("strong");
        assertThat(decision.score()).isEqualTo(75);
        assertThat(decision.reasoning()).isEqualTo("multi-service planning");
    }

    @Test
    void jsonWrappedInProseShouldStillParse() {
        LlmClientRegistry registry = registry("Sure! ```json\n{\"score\": \"12\", \"reasoning\": \"greeting\"}\n```");
        ModelRouter router = new ModelRouter(registry, objectMapper, "fast", "fast", List.of(), 4);

        assertThat(router.route(List.of(new UserMessage("hi"))).provider()).isEqualTo("cheap");
    }

    @Test
    void unparseableOutputShouldFallBackToDefaultProvider() {
        LlmClientRegistry registry = registry("I think this is medium");
        ModelRouter router = new ModelRouter(registry, objectMapper, "fast", "fast", List.of(), 4);

        RoutingDecision decision = router.route(List.of(new UserMessage("hi")));

        assertThat(decision.provider()).isEqualTo("fast");
        assertThat(decision.score()).isEqualTo(-1);
        assertThat(decision.reasoning()).startsWith("fallback:");
    }

    @Test
    void unregisteredTargetShouldFallBackToDefaultProvider() {
        LlmClientRegistry registry = new LlmClientRegistry();
        registry.register("fast", (messages, tools) -> ChatCompletion.text("{\"score\": 90}"));
        ModelRouter router = new ModelRouter(registry, objectMapper, "fast", "fast", List.of(), 4);

        assertThat(router.route(List.of(new UserMessage("big job"))).provider()).isEqualTo("fast");
    }

    @Test
    void classifierShouldOnlySeeRecentConversationalTurns() {
        AtomicReference<List<Message>> seen = new AtomicReference<>();
        LlmClientRegistry registry = new LlmClientRegistry();
        registry.register("fast", (messages, tools) -> {
            seen.set(messages);
            return ChatCompletion.text("{\"score\": 40}");
        });
        ModelRouter router = new ModelRouter(registry, objectMapper, "fast", "fast",
                List.of(new RoutingRule(1, 100, "fast")), 2);
        List<Message> conversation = new ArrayList<>();
        conversation.add(new SystemMessage("you are helpful"));
        conversation.add(new UserMessage("first"));
        conversation.add(new AssistantMessage("answer one"));
        conversation.add(new AssistantMessage("", Map.of(), List.of(
                new AssistantMessage.ToolCall("call_1", "function", "search", "{}"))));
        conversation.add(new UserMessage("second"));

        router.route(conversation);

        assertThat(seen.get()).hasSize(3);
        assertThat(seen.get().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(seen.get().get(0).getText()).contains("complexity classifier");
        assertThat(seen.get().subList(1, 3)).extracting(Message::getText).containsExactly("answer one", "second");
    }

    private LlmClientRegistry registry(String classifierOutput) {
        LlmClientRegistry registry = new LlmClientRegistry();
        registry.register("fast", (messages, tools) -> ChatCompletion.text(classifierOutput));
        registry.register("cheap", (messages, tools) -> ChatCompletion.text("cheap"));
        registry.register("strong", (messages, tools) -> ChatCompletion.text("strong"));
        return registry;
    }
}
