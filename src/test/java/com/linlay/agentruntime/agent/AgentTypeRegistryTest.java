package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTypeRegistryTest {

    private final AgentTypeRegistry registry = TestAgents.registry(MutableClock.startingAt("2026-03-01T09:00:00Z"));

    @Test
    void lookupShouldIgnoreCaseAndSurroundingSpaces() {
        assertThat(registry.find(" Booking ")).isPresent();
        assertThat(registry.isAgentTool("ECHO")).isTrue();
        assertThat(registry.isAgentTool("internal")).isFalse();
        assertThat(registry.isAgentTool("missing")).isFalse();
    }

    @Test
    void agentToolsShouldOnlyListExposedTypes() {
        assertThat(registry.agentTools()).extracting(AgentType::name).containsExactly("booking", "echo");
        assertThat(registry.list()).extracting(AgentType::name).containsExactly("booking", "echo", "internal");
    }

    @Test
    void createShouldPassContextHintsToFactory() {
        Agent agent = registry.create("booking", "tenant-a", Map.of("channel", "sms"));

        assertThat(agent.type()).isEqualTo("booking");
        assertThat(agent.tenantId()).isEqualTo("tenant-a");
        assertThat(agent.context()).containsEntry("channel", "sms");
    }

    @Test
    void unknownTypeShouldRaiseNotFound() {
        assertThatThrownBy(() -> registry.create("travel", "tenant-a", Map.of()))
                .isInstanceOf(AgentTypeNotFoundException.class);
        assertThat(registry.schemaVersion("travel")).isZero();
    }

    @Test
    void agentToolSchemaShouldRequireTaskInstruction() {
        Map<String, Object> schema = registry.get("booking").toolParametersSchema();

        assertThat(schema).containsEntry("type", "object");
        assertThat(schema).containsEntry("required", List.of("task_instruction"));
    }

    @Test
    void schemaVersionShouldIgnoreFieldOrderButTrackFieldChanges() {
        int original = SchemaVersions.of(List.of(
                FieldSpec.required("destination", "str"),
                FieldSpec.required("date", "str")
        ));
        int reordered = SchemaVersions.of(List.of(
                FieldSpec.required("date", "str"),
                FieldSpec.required("destination", "str")
        ));
        int optionalDate = SchemaVersions.of(List.of(
                FieldSpec.required("destination", "str"),
                FieldSpec.optional("date", "str")
        ));

        assertThat(reordered).isEqualTo(original);
        assertThat(optionalDate).isNotEqualTo(original);
        assertThat(SchemaVersions.of(List.of())).isZero();
        assertThat(registry.schemaVersion("booking")).isEqualTo(original);
    }
}
