package com.linlay.agentruntime.llm;

import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * The single capability the runtime needs from a language model.
 */
@FunctionalInterface
public interface LlmClient {

    ChatCompletion chatComplete(List<Message> messages, List<ToolSchema> tools);

    /**
     * Repeats a call the caller has already backed off from. Clients that hold candidates back after a failure
     * let this call through to them.
     */
    default ChatCompletion retryComplete(List<Message> messages, List<ToolSchema> tools) {
        return chatComplete(messages, tools);
    }
}
