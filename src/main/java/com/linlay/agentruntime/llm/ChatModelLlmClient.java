package com.linlay.agentruntime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.List;

/**
 * Adapts a Spring AI {@link ChatModel} to {@link LlmClient}. Tool calls are returned to the caller
 * instead of being executed by Spring AI, so the ReAct loop stays in charge of dispatch.
 */
public class ChatModelLlmClient implements LlmClient {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelLlmClient(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChatCompletion chatComplete(List<Message> messages, List<ToolSchema> tools) {
        ToolCallingChatOptions.Builder options = ToolCallingChatOptions.builder()
                .internalToolExecutionEnabled(false);
        if (tools != null && !tools.isEmpty()) {
            options.toolCallbacks(tools.stream().map(this::toCallback).toList());
        }
        ChatResponse response = chatModel.call(new Prompt(messages, options.build()));
        if (response == null) {
            return ChatCompletion.text("");
        }
        Generation generation = response.getResult();
        AssistantMessage output = generation == null ? null : generation.getOutput();
        String content = output == null ? "" : output.getText();
        List<AssistantMessage.ToolCall> toolCalls = output == null || !output.hasToolCalls()
                ? List.of()
                : output.getToolCalls();
        return new ChatCompletion(content, toolCalls, usageOf(response));
    }

    private TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null) {
            return TokenUsage.EMPTY;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return TokenUsage.EMPTY;
        }
        long input = usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
        long output = usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
        return new TokenUsage(input, output);
    }

    private ToolCallback toCallback(ToolSchema schema) {
        String inputSchema;
        try {
            inputSchema = objectMapper.writeValueAsString(schema.parameters());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize parameters of tool " + schema.name(), ex);
        }
        ToolDefinition definition = ToolDefinition.builder()
                .name(schema.name())
                .description(schema.description())
                .inputSchema(inputSchema)
                .build();
        return new DeclaredOnlyToolCallback(definition);
    }

    /**
     * Advertises a tool to the model. Execution happens in the ReAct loop, never here.
     */
    private record DeclaredOnlyToolCallback(ToolDefinition definition) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new IllegalStateException("Tool " + definition.name() + " is dispatched by the runtime, not by the model client");
        }
    }
}
