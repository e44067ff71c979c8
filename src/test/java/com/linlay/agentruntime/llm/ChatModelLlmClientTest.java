package com.linlay.agentruntime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatModelLlmClientTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatModelLlmClient client = new ChatModelLlmClient(chatModel, new ObjectMapper());

    @Test
    void toolCallsAndUsageShouldBeReturnedWithoutExecutingTools() {
        AssistantMessage.ToolCall call = new AssistantMessage.ToolCall("call_1", "function", "weather", "{\"city\":\"Rome\"}");
        ChatResponse response = new ChatResponse(
                List.of(new Generation(new AssistantMessage("checking", Map.of(), List.of(call)))),
                ChatResponseMetadata.builder().usage(new DefaultUsage(120, 30)).build()
        );
        when(chatModel.call(any(Prompt.class))).thenReturn(response);

        ChatCompletion completion = client.chatComplete(
                List.of(new UserMessage("weather in Rome?")),
                List.of(new ToolSchema("weather", "Current weather", Map.of("type", "object")))
        );

        assertThat(completion.content()).isEqualTo("checking");
        assertThat(completion.toolCalls()).containsExactly(call);
        assertThat(completion.usage()).isEqualTo(new TokenUsage(120, 30));

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        ToolCallingChatOptions options = (ToolCallingChatOptions) prompt.getValue().getOptions();
        assertThat(options.getInternalToolExecutionEnabled()).isFalse();
        assertThat(options.getToolCallbacks()).hasSize(1);
        ToolCallback callback = options.getToolCallbacks().get(0);
        assertThat(callback.getToolDefinition().name()).isEqualTo("weather");
        assertThat(callback.getToolDefinition().inputSchema()).isEqualTo("{\"type\":\"object\"}");
        assertThatThrownBy(() -> callback.call("{}")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void plainAnswerShouldHaveNoToolCalls() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("hello")))));

        ChatCompletion completion = client.chatComplete(List.of(new UserMessage("hi")), List.of());

        assertThat(completion.content()).isEqualTo("hello");
        assertThat(completion.hasToolCalls()).isFalse();
    }
}
