package io.consortium.core.parse;

import io.consortium.core.util.TagUtil;
import java.util.Locale;

/// Recovers reasoning, answer and self-confidence from an agent's free-text reply.
///
/// ### Rules
/// - `<reasoning>`, `<answer>` and `<confidence>` may appear in any order, or not at all
/// - without an `<answer>` tag the whole reply is the answer and reasoning is absent
/// - confidence is read from the tag, or else from a plain `confidence: 0.9` /
///   `confidence level: 85%` line; percentages are scaled into [0, 1]
/// - missing or unusable confidence is absent, never 0
///
/// Parsing never fails.
///
/// @implNote Stateless and thread-safe.
public class ResponseParser {

    public ParsedResponse parse(String rawText) {
        String raw = rawText == null ? "" : rawText;

        String answer = TagUtil.extractTag(raw, "answer");
        if (answer == null) {
            return new ParsedResponse(null, raw, null);
        }
        return new ParsedResponse(
                TagUtil.extractTag(raw, "reasoning"), answer, extractConfidence(raw));
    }

    /// Parses a reply into a successful {@link RoundResponse}.
    public RoundResponse parse(String agentIdentifier, int instanceIndex, String rawText) {
        String raw = rawText == null ? "" : rawText;
        return RoundResponse.success(agentIdentifier, instanceIndex, parse(raw), raw);
    }

    /// Reads a self-reported confidence from a tag or a `confidence:` line.
    ///
    /// @return confidence in [0, 1], or null
    public Double extractConfidence(String text) {
        String tagged = TagUtil.extractTag(text, "confidence");
        if (tagged != null) {
            return TagUtil.parseConfidence(tagged);
        }

        for (String line : text.toLowerCase(Locale.ROOT).split("\n")) {
            int index = line.indexOf("confidence:");
            int length = "confidence:".length();
            if (index < 0) {
                index = line.indexOf("confidence level:");
                length = "confidence level:".length();
            }
            if (index >= 0) {
                Double value = TagUtil.parseConfidence(line.substring(index + length));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }
}
