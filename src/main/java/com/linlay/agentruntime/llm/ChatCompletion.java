package com.linlay.agentruntime.llm;

import org.springframework.ai.chat.messages.AssistantMessage;

import java.util.List;

/**
 * Provider-neutral result of one model call.
 */
public record ChatCompletion(
        String content,
        List<AssistantMessage.ToolCall> toolCalls,
        TokenUsage usage
) {

    public ChatCompletion {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }

    public static ChatCompletion text(String content) {
        return new ChatCompletion(content, List.of(), TokenUsage.EMPTY);
    }

    public static ChatCompletion toolCalls(List<AssistantMessage.ToolCall> toolCalls) {
        return new ChatCompletion("", toolCalls, TokenUsage.EMPTY);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
