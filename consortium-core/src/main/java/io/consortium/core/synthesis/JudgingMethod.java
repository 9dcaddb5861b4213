package io.consortium.core.synthesis;

import io.consortium.core.exception.ConsortiumConfigurationException;
import java.util.Locale;

/// How the arbiter turns a round of responses into a result.
public enum JudgingMethod {
    /// The arbiter writes a new synthesis and scores its own confidence.
    DEFAULT,
    /// The arbiter selects the single best response by id.
    PICK_ONE,
    /// The arbiter orders all responses; the top one becomes the result.
    RANK;

    /// Pick-one and rank judge one round only.
    public boolean isSinglePass() {
        return this != DEFAULT;
    }

    /// Parses `default`, `pick-one` or `rank`, case-insensitively.
    ///
    /// @throws ConsortiumConfigurationException for any other value
    public static JudgingMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConsortiumConfigurationException(
                    "Unknown judging method '" + value + "'; expected default, pick-one or rank",
                    e);
        }
    }
}
