package com.linlay.agentruntime.memory;

import com.linlay.agentruntime.agent.runtime.ReactLoopConfig;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a conversation inside the model's context window.
 * <p>
 * Three levels, from cheapest to most aggressive:
 * <ol>
 *     <li>{@link #truncateToolResult(String)} caps one oversized tool payload,</li>
 *     <li>{@link #trimIfNeeded(List)} drops old history once the estimate crosses the trim threshold,</li>
 *     <li>{@link #forceTrim(List)} keeps only the system prompt and the last few messages after an overflow.</li>
 * </ol>
 * All methods return new lists and never mutate their input. A trimmed history never starts with a tool
 * response, so every kept response still follows the assistant message that asked for it.
 */
public class ContextManager {

    public static final String TRUNCATION_MARKER = "\n[...truncated]";
    static final int FORCE_TRIM_KEEP = 5;
    private static final int CHARS_PER_TOKEN = 4;

    private final ReactLoopConfig config;

    public ContextManager(ReactLoopConfig config) {
        this.config = config == null ? ReactLoopConfig.DEFAULT : config;
    }

    public ReactLoopConfig config() {
        return config;
    }

    public int estimateTokens(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        long chars = 0;
        for (Message message : messages) {
            chars += charCount(message);
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / CHARS_PER_TOKEN);
    }

    public int maxToolResultChars() {
        double byShare = (double) config.contextTokenLimit() * config.maxToolResultShare() * CHARS_PER_TOKEN;
        return (int) Math.min(byShare, config.maxToolResultChars());
    }

    public String truncateToolResult(String result) {
        if (result == null) {
            return "";
        }
        int maxChars = maxToolResultChars();
        if (result.length() <= maxChars) {
            return result;
        }
        int budget = maxChars - TRUNCATION_MARKER.length();
        if (budget <= 0) {
            return result.substring(0, maxChars);
        }
        String cut = result.substring(0, budget);
        int lastNewline = cut.lastIndexOf('\n');
        if (lastNewline > budget / 2) {
            cut = cut.substring(0, lastNewline);
        }
        return cut + TRUNCATION_MARKER;
    }

    public List<Message> trimIfNeeded(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        int threshold = (int) (config.contextTokenLimit() * config.contextTrimThreshold());
        if (estimateTokens(messages) <= threshold) {
            return new ArrayList<>(messages);
        }
        return keepSystemAndTail(messages, config.maxHistoryMessages());
    }

    public List<Message> truncateAllToolResults(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<Message> result = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (message instanceof ToolResponseMessage toolMessage) {
                List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
                for (ToolResponseMessage.ToolResponse response : toolMessage.getResponses()) {
                    responses.add(new ToolResponseMessage.ToolResponse(
                            response.id(),
                            response.name(),
                            truncateToolResult(response.responseData())
                    ));
                }
                result.add(new ToolResponseMessage(responses));
            } else {
                result.add(message);
            }
        }
        return result;
    }

    public List<Message> forceTrim(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        return keepSystemAndTail(messages, FORCE_TRIM_KEEP);
    }

    private List<Message> keepSystemAndTail(List<Message> messages, int keep) {
        List<Message> trimmed = new ArrayList<>();
        int start = 0;
        if (messages.get(0) instanceof SystemMessage) {
            trimmed.add(messages.get(0));
            start = 1;
        }
        int from = Math.max(start, messages.size() - keep);
        // a tool response whose assistant tool call was cut off would be rejected by the provider
        while (from < messages.size() && messages.get(from) instanceof ToolResponseMessage) {
            from++;
        }
        trimmed.addAll(messages.subList(from, messages.size()));
        return trimmed;
    }

    private long charCount(Message message) {
        if (message == null) {
            return 0;
        }
        long chars = 0;
        if (message instanceof ToolResponseMessage toolMessage) {
            for (ToolResponseMessage.ToolResponse response : toolMessage.getResponses()) {
                chars += length(response.responseData());
            }
            return chars;
        }
        chars += length(message.getText());
        if (message instanceof AssistantMessage assistant && assistant.hasToolCalls()) {
            for (AssistantMessage.ToolCall call : assistant.getToolCalls()) {
                chars += length(call.name()) + length(call.arguments());
            }
        }
        return chars;
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
