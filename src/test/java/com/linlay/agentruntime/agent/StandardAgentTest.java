package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardAgentTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");

    @Test
    void bookingFlowShouldCollectFieldsThenWaitForApprovalThenComplete() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);
        assertThat(agent.status()).isEqualTo(AgentStatus.INITIALIZING);
        assertThat(agent.id()).startsWith("booking_");

        AgentReply first = agent.reply("Lisbon");
        assertThat(first.status()).isEqualTo(AgentStatus.WAITING_FOR_INPUT);
        assertThat(first.rawMessage()).isEqualTo("Which date?");
        assertThat(first.collectedFields()).containsEntry("destination", "Lisbon");

        AgentReply second = agent.reply("2026-04-02");
        assertThat(second.status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
        assertThat(second.rawMessage()).isEqualTo("Book Lisbon on 2026-04-02?");

        AgentReply done = agent.reply("Yes");
        assertThat(done.status()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(done.isCompleted()).isTrue();
        assertThat(done.rawMessage()).isEqualTo("Booked Lisbon on 2026-04-02.");
    }

    @Test
    void rejectingApprovalShouldCancel() {
        TestAgents.BookingAgent agent = waitingForApproval();

        AgentReply reply = agent.reply("no");

        assertThat(reply.status()).isEqualTo(AgentStatus.CANCELLED);
        assertThat(reply.rawMessage()).isEqualTo("Cancelled.");
    }

    @Test
    void otherTextDuringApprovalShouldBeTreatedAsModification() {
        TestAgents.BookingAgent agent = waitingForApproval();

        AgentReply reply = agent.reply("make it Porto instead");

        assertThat(reply.status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
        assertThat(agent.collectedFields()).containsEntry("destination", "Lisbon");
    }

    @Test
    void failureInsideHandlerShouldMoveAgentToErrorWithMessage() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);

        AgentReply reply = agent.reply("please explode");

        assertThat(reply.status()).isEqualTo(AgentStatus.ERROR);
        assertThat(reply.errorMessage()).isEqualTo("booking backend unavailable");
        assertThat(agent.status()).isEqualTo(AgentStatus.ERROR);
    }

    @Test
    void pauseAndResumeShouldReturnToPreviousWaitingStatus() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);
        agent.reply("Lisbon");

        AgentReply paused = agent.pause();
        assertThat(paused.status()).isEqualTo(AgentStatus.PAUSED);
        assertThat(paused.rawMessage()).isEqualTo("Task paused.");

        AgentReply ignored = agent.reply("2026-04-02");
        assertThat(ignored.status()).isEqualTo(AgentStatus.PAUSED);
        assertThat(agent.collectedFields()).doesNotContainKey("date");

        AgentReply resumed = agent.resume(null);
        assertThat(resumed.status()).isEqualTo(AgentStatus.WAITING_FOR_INPUT);
        assertThat(resumed.rawMessage()).isEqualTo("Which date?");
    }

    @Test
    void resumeWithMessageShouldContinueTheConversation() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);
        agent.reply("Lisbon");
        agent.pause();

        AgentReply reply = agent.resume("2026-04-02");

        assertThat(reply.status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
    }

    @Test
    void replyShouldRefreshLastActivity() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);
        clock.advance(Duration.ofMinutes(5));

        agent.reply("Lisbon");

        assertThat(agent.lastActivity()).isEqualTo(agent.createdAt().plus(Duration.ofMinutes(5)));
    }

    @Test
    void illegalTransitionShouldBeRejected() {
        TestAgents.BookingAgent agent = waitingForApproval();
        agent.reply("yes");

        assertThatThrownBy(() -> agent.transitionTo(AgentStatus.RUNNING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED -> RUNNING");
        assertThat(agent.reply("again").rawMessage()).isEmpty();
    }

    @Test
    void restoreStateShouldOverwriteIdentityStatusAndFields() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);

        agent.restoreState(
                "booking_restored",
                AgentStatus.WAITING_FOR_INPUT,
                Map.of("destination", "Oslo"),
                Map.of("step", "date"),
                Map.of("channel", "chat")
        );

        assertThat(agent.id()).isEqualTo("booking_restored");
        assertThat(agent.status()).isEqualTo(AgentStatus.WAITING_FOR_INPUT);
        assertThat(agent.collectedFields()).containsExactly(Map.entry("destination", "Oslo"));
        assertThat(agent.context()).containsEntry("channel", "chat");
        assertThat(agent.reply("2026-06-01").status()).isEqualTo(AgentStatus.WAITING_FOR_APPROVAL);
    }

    @Test
    void blankTenantShouldBeRejected() {
        assertThatThrownBy(() -> new TestAgents.BookingAgent(" ", Map.of(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private TestAgents.BookingAgent waitingForApproval() {
        TestAgents.BookingAgent agent = new TestAgents.BookingAgent("tenant-a", Map.of(), clock);
        agent.reply("Lisbon");
        agent.reply("2026-04-02");
        return agent;
    }
}
