package io.consortium.core.dispatch;

import io.consortium.core.agent.Agent;
import io.consortium.core.roster.Roster;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One unit of dispatch: a single instance of a roster identifier.
///
/// @param agentIdentifier roster identifier, not null
/// @param instanceIndex 1-based instance number
/// @param agent the resolved agent to invoke, not null
public record AgentTask(String agentIdentifier, int instanceIndex, Agent agent) {

    public AgentTask {
        Objects.requireNonNull(agentIdentifier, "agentIdentifier must not be null");
        Objects.requireNonNull(agent, "agent must not be null");
    }

    /// Expands a roster into tasks, `instanceCount` per entry, in roster order.
    ///
    /// @param roster the roster to expand, not null
    /// @param agents resolved agents keyed by roster identifier, containing every identifier
    /// @return tasks with instance indices `1..n` per identifier, never null
    /// @throws IllegalArgumentException if an identifier has no resolved agent
    public static List<AgentTask> expand(Roster roster, Map<String, Agent> agents) {
        List<AgentTask> tasks = new ArrayList<>(roster.totalInstances());
        roster.getSpecs()
                .forEach(
                        spec -> {
                            Agent agent = agents.get(spec.identifier());
                            if (agent == null) {
                                throw new IllegalArgumentException(
                                        "No agent resolved for roster identifier: "
                                                + spec.identifier());
                            }
                            for (int i = 1; i <= spec.instanceCount(); i++) {
                                tasks.add(new AgentTask(spec.identifier(), i, agent));
                            }
                        });
        return tasks;
    }

    public String label() {
        return agentIdentifier + "#" + instanceIndex;
    }
}
