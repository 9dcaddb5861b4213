package io.consortium.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.consortium.core.exception.AgentNotFoundException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultAgentRegistryTest {

    @Mock private AgentFactory agentFactory;

    @Mock private Agent mockAgent;

    @Mock private Agent mockAgent2;

    private DefaultAgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultAgentRegistry(agentFactory);
    }

    @Nested
    class RegisterAgentTest {

        @Test
        void shouldRegisterAgentWithConfig() {
            // Given
            AgentConfig config = createConfig("judge", "claude-sonnet-4");
            when(agentFactory.createAgent(eq("judge"), any(AgentConfig.class)))
                    .thenReturn(mockAgent);

            // When
            Agent result = registry.registerAgent("judge", config);

            // Then
            assertThat(result).isSameAs(mockAgent);
            assertThat(registry.hasAgent("judge")).isTrue();
            verify(agentFactory).createAgent("judge", config);
        }

        @Test
        void shouldReplaceExistingAgent() {
            // Given
            when(agentFactory.createAgent(eq("judge"), any(AgentConfig.class)))
                    .thenReturn(mockAgent)
                    .thenReturn(mockAgent2);

            // When
            registry.registerAgent("judge", createConfig("judge", "claude-sonnet-4"));
            Agent result = registry.registerAgent("judge", createConfig("judge", "gpt-4o"));

            // Then
            assertThat(result).isSameAs(mockAgent2);
            assertThat(registry.getAgentIds()).containsExactly("judge");
        }

        @Test
        void shouldRegisterMultipleAgents() {
            // Given
            Map<String, AgentConfig> configs =
                    Map.of(
                            "gpt", createConfig("gpt", "gpt-4o"),
                            "claude", createConfig("claude", "claude-sonnet-4"));
            when(agentFactory.createAgent(anyString(), any(AgentConfig.class)))
                    .thenReturn(mockAgent);

            // When
            registry.registerAgents(configs);

            // Then
            assertThat(registry.getAgentIds()).containsExactlyInAnyOrder("gpt", "claude");
        }

        @Test
        void shouldRegisterAgentInstanceUnderItsId() {
            when(mockAgent.getId()).thenReturn("scripted");

            registry.registerAgent(mockAgent);

            assertThat(registry.getAgent("scripted")).containsSame(mockAgent);
            verifyNoInteractions(agentFactory);
        }

        @Test
        void shouldRejectBlankId() {
            assertThatThrownBy(() -> registry.registerAgent(" ", createConfig("x", "m")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class ResolveAgentTest {

        @Test
        void shouldReturnRegisteredAgentFirst() throws Exception {
            when(mockAgent.getId()).thenReturn("gpt-4o");
            registry.registerAgent(mockAgent);

            assertThat(registry.resolveAgent("gpt-4o")).isSameAs(mockAgent);
            verifyNoInteractions(agentFactory);
        }

        @Test
        void shouldCreateAgentLazilyUsingIdentifierAsModel() throws Exception {
            // Given
            when(agentFactory.isModelSupported("gpt-4o")).thenReturn(true);
            when(agentFactory.createAgent(eq("gpt-4o"), any(AgentConfig.class)))
                    .thenReturn(mockAgent);

            // When
            Agent first = registry.resolveAgent("gpt-4o");
            Agent second = registry.resolveAgent("gpt-4o");

            // Then
            assertThat(first).isSameAs(mockAgent).isSameAs(second);
            verify(agentFactory, times(1)).createAgent("gpt-4o", AgentConfig.forModel("gpt-4o"));
        }

        @Test
        void shouldThrowWhenNoProviderSupportsIdentifier() {
            when(agentFactory.isModelSupported("mystery")).thenReturn(false);

            assertThatThrownBy(() -> registry.resolveAgent("mystery"))
                    .isInstanceOf(AgentNotFoundException.class)
                    .hasMessageContaining("mystery");
            verify(agentFactory, never()).createAgent(anyString(), any());
        }
    }

    @Nested
    class LookupTest {

        @Test
        void shouldReturnEmptyForUnknownAgent() {
            assertThat(registry.getAgent("missing")).isEmpty();
            assertThatThrownBy(() -> registry.getAgentOrThrow("missing"))
                    .isInstanceOf(AgentNotFoundException.class)
                    .hasMessage("Agent not found: missing");
        }

        @Test
        void shouldUnregisterAgent() {
            when(mockAgent.getId()).thenReturn("gpt");
            registry.registerAgent(mockAgent);

            assertThat(registry.unregisterAgent("gpt")).isTrue();
            assertThat(registry.unregisterAgent("gpt")).isFalse();
            assertThat(registry.hasAgent("gpt")).isFalse();
        }
    }

    // -- Helpers --

    private AgentConfig createConfig(String id, String model) {
        return AgentConfig.builder().id(id).model(model).build();
    }
}
