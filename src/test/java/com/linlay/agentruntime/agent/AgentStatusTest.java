package com.linlay.agentruntime.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentStatusTest {

    @Test
    void terminalStatusesShouldAllowNoFurtherTransitionsExceptErrorToCancelled() {
        assertThat(AgentStatus.COMPLETED.allowedTargets()).isEmpty();
        assertThat(AgentStatus.CANCELLED.allowedTargets()).isEmpty();
        assertThat(AgentStatus.ERROR.allowedTargets()).containsExactly(AgentStatus.CANCELLED);
        assertThat(AgentStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(AgentStatus.ERROR.isTerminal()).isTrue();
        assertThat(AgentStatus.PAUSED.isTerminal()).isFalse();
    }

    @Test
    void waitingStatusesShouldBeInputAndApprovalOnly() {
        assertThat(AgentStatus.WAITING_FOR_INPUT.isWaiting()).isTrue();
        assertThat(AgentStatus.WAITING_FOR_APPROVAL.isWaiting()).isTrue();
        assertThat(AgentStatus.RUNNING.isWaiting()).isFalse();
        assertThat(AgentStatus.PAUSED.isWaiting()).isFalse();
    }

    @Test
    void pausedShouldNotJumpStraightToCompleted() {
        assertThat(AgentStatus.PAUSED.canTransitionTo(AgentStatus.COMPLETED)).isFalse();
        assertThat(AgentStatus.PAUSED.canTransitionTo(AgentStatus.WAITING_FOR_INPUT)).isTrue();
        assertThat(AgentStatus.RUNNING.canTransitionTo(AgentStatus.INITIALIZING)).isFalse();
        assertThat(AgentStatus.RUNNING.canTransitionTo(null)).isFalse();
    }

    @Test
    void wireValueShouldRoundTripThroughFromValue() {
        for (AgentStatus status : AgentStatus.values()) {
            assertThat(AgentStatus.fromValue(status.wireValue())).isEqualTo(status);
        }
        assertThat(AgentStatus.WAITING_FOR_APPROVAL.wireValue()).isEqualTo("waiting_for_approval");
        assertThatThrownBy(() -> AgentStatus.fromValue(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
