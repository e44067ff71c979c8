package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.llm.AllCandidatesExhaustedException;
import com.linlay.agentruntime.llm.ChatCompletion;
import com.linlay.agentruntime.llm.FailoverReason;
import com.linlay.agentruntime.llm.FallbackAttempt;
import com.linlay.agentruntime.llm.LlmClient;
import com.linlay.agentruntime.llm.LlmClientRegistry;
import com.linlay.agentruntime.llm.ModelRouter;
import com.linlay.agentruntime.llm.RoutingDecision;
import com.linlay.agentruntime.llm.TokenUsage;
import com.linlay.agentruntime.llm.ToolSchema;
import com.linlay.agentruntime.memory.ContextManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reason-act loop. Each turn asks the model and runs the tool calls it returns; the loop stops on a plain
 * answer or when an agent has to ask the user. Running out of turns ends with a summary call.
 */
public class ReactEngine {

    private static final Logger log = LoggerFactory.getLogger(ReactEngine.class);

    public static final String APOLOGY = "I'm sorry, I wasn't able to complete this request. Please try again.";

    static final String SUMMARY_PROMPT = "You have used all available tool turns. Using the information gathered so far, "
            + "give the user your best final answer now without calling any tools.";

    private final LlmClient defaultClient;
    private final ModelRouter router;
    private final LlmClientRegistry routedClients;
    private final ToolDispatcher toolDispatcher;
    private final ContextManager contextManager;
    private final ReactLoopConfig config;

    public ReactEngine(
            LlmClient defaultClient,
            ToolDispatcher toolDispatcher,
            ContextManager contextManager,
            ReactLoopConfig config
    ) {
        this(defaultClient, null, null, toolDispatcher, contextManager, config);
    }

    public ReactEngine(
            LlmClient defaultClient,
            ModelRouter router,
            LlmClientRegistry routedClients,
            ToolDispatcher toolDispatcher,
            ContextManager contextManager,
            ReactLoopConfig config
    ) {
        this.defaultClient = defaultClient;
        this.router = router;
        this.routedClients = routedClients;
        this.toolDispatcher = toolDispatcher;
        this.config = config == null ? ReactLoopConfig.DEFAULT : config;
        this.contextManager = contextManager == null ? new ContextManager(this.config) : contextManager;
    }

    public ReactLoopConfig config() {
        return config;
    }

    public ReactLoopResult run(List<Message> messages, List<ToolSchema> toolSchemas, String tenantId) {
        long start = System.nanoTime();
        List<Message> conversation = new ArrayList<>(messages == null ? List.of() : messages);
        List<ToolSchema> tools = toolSchemas == null ? List.of() : toolSchemas;
        List<ToolCallRecord> records = new ArrayList<>();
        List<ApprovalRequest> approvals = new ArrayList<>();
        TokenUsage usage = TokenUsage.EMPTY;
        LlmClient client = selectClient(conversation);

        for (int turn = 1; turn <= config.maxTurns(); turn++) {
            conversation = contextManager.trimIfNeeded(TranscriptRepair.repair(conversation));
            CallResult call = callWithRecovery(client, conversation, tools);
            conversation = call.messages();
            ChatCompletion completion = call.completion();
            usage = usage.plus(completion.usage());

            if (!completion.hasToolCalls()) {
                log.debug("[react] tenant={} final answer at turn {}", tenantId, turn);
                return result(completion.content(), turn, records, usage, start, approvals);
            }

            List<AssistantMessage.ToolCall> toolCalls = completion.toolCalls();
            conversation.add(new AssistantMessage(completion.content(), Map.of(), toolCalls));
            List<ToolOutcome> outcomes = toolDispatcher.executeAll(toolCalls, tenantId, historyOf(conversation));

            int perCallTokens = toolCalls.isEmpty() ? 0 : (int) (completion.usage().outputTokens() / toolCalls.size());
            ToolOutcome needsUser = null;
            for (int i = 0; i < outcomes.size(); i++) {
                ToolOutcome outcome = outcomes.get(i);
                String content = contextManager.truncateToolResult(outcome.content());
                conversation.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(outcome.callId(), outcome.toolName(), content)
                )));
                records.add(new ToolCallRecord(
                        outcome.toolName(),
                        ToolCallRecord.summarize(toolCalls.get(i).arguments()),
                        outcome.durationMs(),
                        outcome.success(),
                        outcome.resultStatus(),
                        content.length(),
                        perCallTokens
                ));
                if (outcome.approvalRequest() != null) {
                    approvals.add(outcome.approvalRequest());
                }
                if (needsUser == null && outcome.needsUser()) {
                    needsUser = outcome;
                }
            }
            if (needsUser != null) {
                log.info("[react] tenant={} agent {} needs the user ({}), ending loop at turn {}",
                        tenantId, needsUser.agentId(), needsUser.resultStatus(), turn);
                return result(needsUser.content(), turn, records, usage, start, approvals);
            }
        }

        log.info("[react] tenant={} reached max turns ({}), asking for a summary", tenantId, config.maxTurns());
        String answer = summarize(client, conversation);
        return result(answer, config.maxTurns(), records, usage, start, approvals);
    }

    private String summarize(LlmClient client, List<Message> conversation) {
        List<Message> messages = new ArrayList<>(contextManager.trimIfNeeded(TranscriptRepair.repair(conversation)));
        messages.add(new UserMessage(SUMMARY_PROMPT));
        try {
            ChatCompletion summary = client.chatComplete(messages, List.of());
            if (StringUtils.hasText(summary.content())) {
                return summary.content();
            }
        } catch (RuntimeException ex) {
            log.warn("[react] summary call failed: {}", ex.getMessage());
        }
        return APOLOGY;
    }

    private LlmClient selectClient(List<Message> conversation) {
        if (router == null || routedClients == null) {
            return defaultClient;
        }
        RoutingDecision decision = router.route(conversation);
        return routedClients.find(decision.provider()).orElse(defaultClient);
    }

    /**
     * Calls the model, applying the retry policy for each failure kind. Context overflow recovery shrinks the
     * conversation, so the messages actually sent are returned alongside the completion. An exhausted fallback
     * chain is judged by what its candidates reported.
     */
    CallResult callWithRecovery(LlmClient client, List<Message> messages, List<ToolSchema> tools) {
        List<Message> current = new ArrayList<>(messages);
        int rateLimitRetries = 0;
        boolean timeoutRetried = false;
        int overflowStage = 0;
        boolean retrying = false;
        while (true) {
            try {
                ChatCompletion completion = retrying
                        ? client.retryComplete(current, tools)
                        : client.chatComplete(current, tools);
                return new CallResult(completion, current);
            } catch (RuntimeException ex) {
                retrying = true;
                if (isContextOverflow(ex)) {
                    overflowStage++;
                    current = switch (overflowStage) {
                        case 1 -> new ArrayList<>(contextManager.trimIfNeeded(current));
                        case 2 -> new ArrayList<>(contextManager.truncateAllToolResults(current));
                        case 3 -> new ArrayList<>(contextManager.forceTrim(current));
                        default -> throw new LlmCallException(FailoverReason.FORMAT,
                                "Context overflow persists after trimming: " + ex.getMessage(), ex);
                    };
                    log.warn("[react] context overflow, recovery step {} ({} messages)", overflowStage, current.size());
                    continue;
                }
                FailoverReason reason = classify(ex);
                switch (reason) {
                    case RATE_LIMIT -> {
                        if (rateLimitRetries >= config.llmMaxRetries()) {
                            throw new LlmCallException(reason, "Rate limited after " + rateLimitRetries + " retries", ex);
                        }
                        Duration delay = config.llmRetryBaseDelay().multipliedBy(1L << rateLimitRetries);
                        rateLimitRetries++;
                        log.warn("[react] rate limited, retry {} in {}ms", rateLimitRetries, delay.toMillis());
                        sleep(delay);
                    }
                    case TIMEOUT -> {
                        if (timeoutRetried) {
                            throw new LlmCallException(reason, "Model call timed out twice", ex);
                        }
                        timeoutRetried = true;
                        log.warn("[react] model call timed out, retrying once");
                    }
                    default -> throw ex;
                }
            }
        }
    }

    static boolean isContextOverflow(Throwable error) {
        if (error instanceof AllCandidatesExhaustedException exhausted) {
            return exhausted.attempts().stream()
                    .filter(attempt -> attempt.reason() != FailoverReason.COOLDOWN)
                    .anyMatch(attempt -> FailoverReason.isContextOverflow(attempt.error()));
        }
        return FailoverReason.isContextOverflow(error.getMessage());
    }

    /**
     * An exhausted chain is retryable only when every candidate that was actually called failed for the same
     * transient reason. Anything else, including a chain that was entirely in cooldown, propagates.
     */
    static FailoverReason classify(RuntimeException error) {
        if (!(error instanceof AllCandidatesExhaustedException exhausted)) {
            return FailoverReason.classify(error);
        }
        List<FailoverReason> reasons = exhausted.attempts().stream()
                .map(FallbackAttempt::reason)
                .filter(reason -> reason != FailoverReason.COOLDOWN)
                .distinct()
                .toList();
        if (reasons.size() == 1
                && (reasons.get(0) == FailoverReason.RATE_LIMIT || reasons.get(0) == FailoverReason.TIMEOUT)) {
            return reasons.get(0);
        }
        return FailoverReason.UNKNOWN;
    }

    private void sleep(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LlmCallException(FailoverReason.RATE_LIMIT, "Interrupted while waiting to retry", ex);
        }
    }

    private List<Map<String, Object>> historyOf(List<Message> conversation) {
        List<Map<String, Object>> history = new ArrayList<>(conversation.size());
        for (Message message : conversation) {
            if (message instanceof SystemMessage) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("role", message.getMessageType().getValue());
            if (message instanceof ToolResponseMessage toolMessage) {
                entry.put("content", toolMessage.getResponses().stream()
                        .map(ToolResponseMessage.ToolResponse::responseData)
                        .toList());
            } else {
                entry.put("content", message.getText() == null ? "" : message.getText());
            }
            history.add(entry);
        }
        return history;
    }

    private ReactLoopResult result(
            String response,
            int turns,
            List<ToolCallRecord> records,
            TokenUsage usage,
            long startNanos,
            List<ApprovalRequest> approvals
    ) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        return new ReactLoopResult(response, turns, records, usage, durationMs, approvals);
    }

    record CallResult(ChatCompletion completion, List<Message> messages) {
    }
}
