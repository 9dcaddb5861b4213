package io.consortium.core.roster;

import io.consortium.core.exception.ConsortiumConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Ordered, duplicate-free list of {@link AgentSpec} entries queried every round.
///
/// ### Syntax
/// `a:1,b:2,c` parses to three entries; `c` takes the default count. Every round then
/// issues `1 + 2 + default` tasks.
///
/// ### Contracts
/// - **Invariant**: at least one entry
/// - **Invariant**: identifiers are unique
///
/// @implNote Immutable and thread-safe.
public final class Roster {

    private final List<AgentSpec> specs;

    private Roster(List<AgentSpec> specs) {
        if (specs.isEmpty()) {
            throw new ConsortiumConfigurationException("Roster must contain at least one agent");
        }
        Set<String> seen = new HashSet<>();
        for (AgentSpec spec : specs) {
            if (!seen.add(spec.identifier())) {
                throw new ConsortiumConfigurationException(
                        "Duplicate roster identifier '"
                                + spec.identifier()
                                + "'; use '"
                                + spec.identifier()
                                + ":<count>' to query several instances");
            }
        }
        this.specs = List.copyOf(specs);
    }

    public static Roster of(AgentSpec... specs) {
        return new Roster(Arrays.asList(specs));
    }

    public static Roster of(List<AgentSpec> specs) {
        return new Roster(specs);
    }

    /// Parses a comma-separated roster string with a default count of 1.
    ///
    /// @throws ConsortiumConfigurationException if an entry or the roster is invalid
    public static Roster parse(String roster) {
        return parse(roster, 1);
    }

    /// Parses a comma-separated roster string.
    ///
    /// @param roster entries such as `a:1,b:2`, not null
    /// @param defaultCount count for entries without one, at least 1
    /// @throws ConsortiumConfigurationException if an entry or the roster is invalid
    public static Roster parse(String roster, int defaultCount) {
        if (roster == null) {
            throw new ConsortiumConfigurationException("Roster must contain at least one agent");
        }
        return parse(Arrays.asList(roster.split(",")), defaultCount);
    }

    /// Parses roster entries given one per element; blank elements are skipped.
    public static Roster parse(List<String> entries, int defaultCount) {
        if (defaultCount < 1) {
            throw new ConsortiumConfigurationException(
                    "Default instance count must be at least 1, got " + defaultCount);
        }
        List<AgentSpec> specs = new ArrayList<>();
        for (String entry : entries) {
            if (entry != null && !entry.isBlank()) {
                specs.add(AgentSpec.parse(entry, defaultCount));
            }
        }
        return new Roster(specs);
    }

    public List<AgentSpec> getSpecs() {
        return specs;
    }

    /// @return distinct agent identifiers in roster order
    public List<String> identifiers() {
        return specs.stream().map(AgentSpec::identifier).toList();
    }

    /// @return number of tasks issued per round
    public int totalInstances() {
        return specs.stream().mapToInt(AgentSpec::instanceCount).sum();
    }

    /// @return identifier to instance count, in roster order
    public Map<String, Integer> instanceCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        specs.forEach(spec -> counts.put(spec.identifier(), spec.instanceCount()));
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Roster that)) return false;
        return specs.equals(that.specs);
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return String.join(",", specs.stream().map(AgentSpec::toString).toList());
    }
}
