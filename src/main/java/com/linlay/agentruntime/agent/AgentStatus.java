package com.linlay.agentruntime.agent;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum AgentStatus {
    INITIALIZING,
    RUNNING,
    WAITING_FOR_INPUT,
    WAITING_FOR_APPROVAL,
    PAUSED,
    COMPLETED,
    ERROR,
    CANCELLED;

    private static final Set<AgentStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, ERROR);
    private static final Set<AgentStatus> WAITING = EnumSet.of(WAITING_FOR_INPUT, WAITING_FOR_APPROVAL);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isWaiting() {
        return WAITING.contains(this);
    }

    public boolean canTransitionTo(AgentStatus target) {
        if (target == null) {
            return false;
        }
        return allowedTargets().contains(target);
    }

    public Set<AgentStatus> allowedTargets() {
        return switch (this) {
            case INITIALIZING -> EnumSet.of(RUNNING, WAITING_FOR_INPUT, WAITING_FOR_APPROVAL, PAUSED, COMPLETED, ERROR, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, ERROR, PAUSED, WAITING_FOR_INPUT, WAITING_FOR_APPROVAL, CANCELLED);
            case WAITING_FOR_INPUT -> EnumSet.of(RUNNING, WAITING_FOR_APPROVAL, PAUSED, COMPLETED, ERROR, WAITING_FOR_INPUT, CANCELLED);
            case WAITING_FOR_APPROVAL -> EnumSet.of(RUNNING, WAITING_FOR_INPUT, WAITING_FOR_APPROVAL, PAUSED, COMPLETED, ERROR, CANCELLED);
            case PAUSED -> EnumSet.of(INITIALIZING, RUNNING, WAITING_FOR_INPUT, WAITING_FOR_APPROVAL, ERROR, CANCELLED);
            case ERROR -> EnumSet.of(CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(AgentStatus.class);
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("agent status must not be blank");
        }
        return AgentStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
