package com.linlay.agentruntime.agent.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Makes a message list acceptable to providers that insist every assistant tool call is followed by
 * exactly one tool response.
 * <ul>
 *     <li>tool calls without a name or arguments are dropped, and an assistant message left with neither
 *     text nor calls goes with them;</li>
 *     <li>each remaining call gets its response placed right after the assistant message, a synthetic
 *     one when none exists;</li>
 *     <li>duplicate and orphaned responses are dropped.</li>
 * </ul>
 * Returns the input list unchanged when nothing needed fixing.
 */
public final class TranscriptRepair {

    public static final String SYNTHETIC_TOOL_RESULT = "[synthetic] missing tool result - inserted for transcript repair";

    private static final Logger log = LoggerFactory.getLogger(TranscriptRepair.class);

    private TranscriptRepair() {
    }

    public static List<Message> repair(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return messages == null ? List.of() : messages;
        }
        List<Message> withValidCalls = dropInvalidToolCalls(messages);
        return repairPairing(withValidCalls);
    }

    static List<Message> dropInvalidToolCalls(List<Message> messages) {
        boolean changed = false;
        List<Message> repaired = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (!(message instanceof AssistantMessage assistant) || !assistant.hasToolCalls()) {
                repaired.add(message);
                continue;
            }
            List<AssistantMessage.ToolCall> valid = new ArrayList<>();
            for (AssistantMessage.ToolCall call : assistant.getToolCalls()) {
                if (StringUtils.hasText(call.name()) && StringUtils.hasText(call.arguments())) {
                    valid.add(call);
                } else {
                    log.warn("[transcript] dropped tool call {} ({}): missing name or arguments", call.id(), call.name());
                }
            }
            if (valid.size() == assistant.getToolCalls().size()) {
                repaired.add(message);
                continue;
            }
            changed = true;
            if (!valid.isEmpty() || StringUtils.hasText(assistant.getText())) {
                repaired.add(new AssistantMessage(assistant.getText(), assistant.getMetadata(), valid));
            } else {
                log.warn("[transcript] dropped assistant message whose tool calls were all invalid");
            }
        }
        return changed ? repaired : messages;
    }

    static List<Message> repairPairing(List<Message> messages) {
        Map<String, List<ToolResponseMessage.ToolResponse>> responsesById = new LinkedHashMap<>();
        for (Message message : messages) {
            if (message instanceof ToolResponseMessage toolMessage) {
                for (ToolResponseMessage.ToolResponse response : toolMessage.getResponses()) {
                    responsesById.computeIfAbsent(response.id(), key -> new ArrayList<>()).add(response);
                }
            }
        }

        boolean changed = false;
        List<Message> repaired = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message instanceof ToolResponseMessage toolMessage) {
                // responses are re-emitted right after their assistant message
                if (!isInPlace(messages, i, toolMessage)) {
                    changed = true;
                    toolMessage.getResponses().stream()
                            .filter(response -> isOrphan(messages, response.id()))
                            .forEach(response -> log.warn("[transcript] dropped orphaned tool result {}", response.id()));
                }
                continue;
            }
            repaired.add(message);
            if (!(message instanceof AssistantMessage assistant) || !assistant.hasToolCalls()) {
                continue;
            }
            Set<String> seen = new HashSet<>();
            for (AssistantMessage.ToolCall call : assistant.getToolCalls()) {
                if (!seen.add(call.id())) {
                    continue;
                }
                List<ToolResponseMessage.ToolResponse> found = responsesById.get(call.id());
                if (found == null || found.isEmpty()) {
                    log.warn("[transcript] inserted synthetic result for tool call {}", call.id());
                    repaired.add(new ToolResponseMessage(List.of(
                            new ToolResponseMessage.ToolResponse(call.id(), call.name(), SYNTHETIC_TOOL_RESULT)
                    )));
                    changed = true;
                    continue;
                }
                repaired.add(new ToolResponseMessage(List.of(found.get(0))));
                if (found.size() > 1) {
                    log.warn("[transcript] dropped {} duplicate result(s) for tool call {}", found.size() - 1, call.id());
                    changed = true;
                }
                // consumed: a later assistant reusing the id gets a synthetic result
                responsesById.put(call.id(), List.of());
            }
        }
        return changed ? repaired : messages;
    }

    /**
     * A response message is in place when it holds a single response and directly follows the assistant
     * message that issued that call, possibly after sibling responses of the same assistant message.
     */
    private static boolean isInPlace(List<Message> messages, int index, ToolResponseMessage toolMessage) {
        if (toolMessage.getResponses().size() != 1) {
            return false;
        }
        String id = toolMessage.getResponses().get(0).id();
        int cursor = index - 1;
        int offset = 0;
        while (cursor >= 0 && messages.get(cursor) instanceof ToolResponseMessage) {
            cursor--;
            offset++;
        }
        if (cursor < 0 || !(messages.get(cursor) instanceof AssistantMessage assistant) || !assistant.hasToolCalls()) {
            return false;
        }
        List<AssistantMessage.ToolCall> calls = assistant.getToolCalls();
        return offset < calls.size() && Objects.equals(calls.get(offset).id(), id);
    }

    private static boolean isOrphan(List<Message> messages, String responseId) {
        for (Message message : messages) {
            if (message instanceof AssistantMessage assistant && assistant.hasToolCalls()) {
                for (AssistantMessage.ToolCall call : assistant.getToolCalls()) {
                    if (Objects.equals(call.id(), responseId)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }
}
