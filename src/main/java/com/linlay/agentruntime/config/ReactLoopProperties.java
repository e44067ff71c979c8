package com.linlay.agentruntime.config;

import com.linlay.agentruntime.agent.runtime.ReactLoopConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "agent.react")
public class ReactLoopProperties {

    @Min(1)
    private int maxTurns = 10;
    @Min(1)
    private long toolTimeoutSeconds = 30;
    @Min(1)
    private long agentToolTimeoutSeconds = 120;
    @DecimalMin("0.01")
    @DecimalMax("1.0")
    private double maxToolResultShare = 0.3;
    @Min(1)
    private int maxToolResultChars = 400_000;
    @Min(1)
    private int contextTokenLimit = 128_000;
    @DecimalMin("0.01")
    @DecimalMax("1.0")
    private double contextTrimThreshold = 0.8;
    @Min(1)
    private int maxHistoryMessages = 40;
    @Min(0)
    private int llmMaxRetries = 2;
    @Min(0)
    private long llmRetryBaseDelayMs = 1000;
    @Min(1)
    private int approvalTimeoutMinutes = 30;
    private String systemPrompt = "You are a helpful assistant. Use the available tools and agents when a request needs them.";

    public ReactLoopConfig toConfig() {
        return new ReactLoopConfig(
                maxTurns,
                Duration.ofSeconds(toolTimeoutSeconds),
                Duration.ofSeconds(agentToolTimeoutSeconds),
                maxToolResultShare,
                maxToolResultChars,
                contextTokenLimit,
                contextTrimThreshold,
                maxHistoryMessages,
                llmMaxRetries,
                Duration.ofMillis(llmRetryBaseDelayMs),
                approvalTimeoutMinutes
        );
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public long getToolTimeoutSeconds() {
        return toolTimeoutSeconds;
    }

    public void setToolTimeoutSeconds(long toolTimeoutSeconds) {
        this.toolTimeoutSeconds = toolTimeoutSeconds;
    }

    public long getAgentToolTimeoutSeconds() {
        return agentToolTimeoutSeconds;
    }

    public void setAgentToolTimeoutSeconds(long agentToolTimeoutSeconds) {
        this.agentToolTimeoutSeconds = agentToolTimeoutSeconds;
    }

    public double getMaxToolResultShare() {
        return maxToolResultShare;
    }

    public void setMaxToolResultShare(double maxToolResultShare) {
        this.maxToolResultShare = maxToolResultShare;
    }

    public int getMaxToolResultChars() {
        return maxToolResultChars;
    }

    public void setMaxToolResultChars(int maxToolResultChars) {
        this.maxToolResultChars = maxToolResultChars;
    }

    public int getContextTokenLimit() {
        return contextTokenLimit;
    }

    public void setContextTokenLimit(int contextTokenLimit) {
        this.contextTokenLimit = contextTokenLimit;
    }

    public double getContextTrimThreshold() {
        return contextTrimThreshold;
    }

    public void setContextTrimThreshold(double contextTrimThreshold) {
        this.contextTrimThreshold = contextTrimThreshold;
    }

    public int getMaxHistoryMessages() {
        return maxHistoryMessages;
    }

    public void setMaxHistoryMessages(int maxHistoryMessages) {
        this.maxHistoryMessages = maxHistoryMessages;
    }

    public int getLlmMaxRetries() {
        return llmMaxRetries;
    }

    public void setLlmMaxRetries(int llmMaxRetries) {
        this.llmMaxRetries = llmMaxRetries;
    }

    public long getLlmRetryBaseDelayMs() {
        return llmRetryBaseDelayMs;
    }

    public void setLlmRetryBaseDelayMs(long llmRetryBaseDelayMs) {
        this.llmRetryBaseDelayMs = llmRetryBaseDelayMs;
    }

    public int getApprovalTimeoutMinutes() {
        return approvalTimeoutMinutes;
    }

    public void setApprovalTimeoutMinutes(int approvalTimeoutMinutes) {
        this.approvalTimeoutMinutes = approvalTimeoutMinutes;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
