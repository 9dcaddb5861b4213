package io.consortium.core.roster;

import io.consortium.core.exception.ConsortiumConfigurationException;

/// One roster entry: an agent identifier and how many independent instances of it to
/// query each round.
///
/// @param identifier agent identifier resolved through the agent registry, not blank
/// @param instanceCount number of instances per round, at least 1
public record AgentSpec(String identifier, int instanceCount) {

    public AgentSpec {
        if (identifier == null || identifier.isBlank()) {
            throw new ConsortiumConfigurationException("Agent identifier must not be blank");
        }
        identifier = identifier.strip();
        if (instanceCount < 1) {
            throw new ConsortiumConfigurationException(
                    "Instance count for '"
                            + identifier
                            + "' must be at least 1, got "
                            + instanceCount);
        }
    }

    /// Creates a single-instance entry.
    public static AgentSpec of(String identifier) {
        return new AgentSpec(identifier, 1);
    }

    /// Parses `identifier` or `identifier:count`.
    ///
    /// The count is split at the last colon so identifiers may themselves contain
    /// colons only when a count follows them.
    ///
    /// @param entry the textual entry, not null
    /// @param defaultCount count used when the entry carries none, at least 1
    /// @return the parsed entry, never null
    /// @throws ConsortiumConfigurationException if the count is not a positive integer
    public static AgentSpec parse(String entry, int defaultCount) {
        String trimmed = entry == null ? "" : entry.strip();
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return new AgentSpec(trimmed, defaultCount);
        }

        String identifier = trimmed.substring(0, colon);
        String count = trimmed.substring(colon + 1).strip();
        try {
            return new AgentSpec(identifier, Integer.parseInt(count));
        } catch (NumberFormatException e) {
            throw new ConsortiumConfigurationException(
                    "Invalid count for model " + identifier.strip() + ": " + count, e);
        }
    }

    @Override
    public String toString() {
        return identifier + ":" + instanceCount;
    }
}
