package io.consortium.core.synthesis;

import io.consortium.core.parse.RoundResponse;
import io.consortium.core.util.TagUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Tolerant parser for arbiter replies.
///
/// ### Synthesis Replies
/// - missing `<synthesis>`: the whole reply is the synthesis
/// - missing or unusable `<confidence>`: 0.0
/// - missing `<needs_iteration>`: false
/// - `<refinement_areas>` without `<area>` items: one area per non-blank line
///
/// ### Pick-one and Rank Replies
/// The chosen (or top-ranked) response's answer becomes the synthesis with confidence
/// 1.0. A reply without a usable id falls back to the raw text with confidence 0.0.
///
/// @implNote Stateless and thread-safe.
public class ArbiterResponseParser {

    private static final Logger logger = Logger.getLogger(ArbiterResponseParser.class.getName());

    private static final Pattern RANK =
            Pattern.compile(
                    "<rank\\s+position=\"\\d+\"\\s*>\\s*(\\d+)\\s*</rank>",
                    Pattern.CASE_INSENSITIVE);

    /// Parses a reply according to the judging method.
    ///
    /// @param text the arbiter's raw reply, not null
    /// @param method how the arbiter was asked to judge, not null
    /// @param responses the responses shown to the arbiter, numbered from 1
    /// @return the parsed result, never null
    public SynthesisResult parse(String text, JudgingMethod method, List<RoundResponse> responses) {
        String raw = text == null ? "" : text;
        try {
            switch (method) {
                case PICK_ONE:
                    return parsePickOne(raw, responses);
                case RANK:
                    return parseRank(raw, responses);
                default:
                    return parseSynthesis(raw);
            }
        } catch (IllegalArgumentException e) {
            logger.warning("Error parsing arbiter response: " + e.getMessage());
            return SynthesisResult.of(
                    raw,
                    0.0,
                    "Parsing failed - see raw response: " + e.getMessage(),
                    false,
                    List.of(),
                    "",
                    raw);
        }
    }

    /// Parses a tagged synthesis reply. Never fails.
    public SynthesisResult parseSynthesis(String text) {
        String synthesis = TagUtil.extractTag(text, "synthesis");

        double confidence = 0.0;
        String confidenceText = TagUtil.extractTag(text, "confidence");
        Double parsed = TagUtil.parseConfidence(confidenceText);
        if (parsed != null) {
            confidence = parsed;
        } else if (confidenceText != null) {
            logger.warning("Could not parse confidence value: " + confidenceText);
        } else {
            logger.warning("Missing confidence in synthesis, using default value 0.0");
        }

        String needsIteration = TagUtil.extractTag(text, "needs_iteration");

        return SynthesisResult.of(
                synthesis != null ? synthesis : text.strip(),
                confidence,
                TagUtil.extractTag(text, "analysis"),
                needsIteration != null && needsIteration.equalsIgnoreCase("true"),
                refinementAreas(TagUtil.extractTag(text, "refinement_areas")),
                TagUtil.extractTag(text, "dissent"),
                text);
    }

    private SynthesisResult parsePickOne(String text, List<RoundResponse> responses) {
        String idText = TagUtil.extractTag(text, "response_id");
        if (idText == null || !idText.matches("\\d+")) {
            throw new IllegalArgumentException("Could not find a valid <response_id> tag.");
        }
        int chosenId = Integer.parseInt(idText);
        RoundResponse chosen = byId(responses, chosenId);
        if (chosen == null) {
            throw new IllegalArgumentException(
                    "Arbiter chose response ID " + chosenId + ", but this ID was not found.");
        }
        return new SynthesisResult(
                chosen.answer(),
                1.0,
                "Arbiter selected response #"
                        + chosenId
                        + " from model '"
                        + chosen.agentIdentifier()
                        + "'.",
                false,
                List.of(),
                "",
                text,
                chosenId,
                List.of());
    }

    private SynthesisResult parseRank(String text, List<RoundResponse> responses) {
        String ranking = TagUtil.extractTag(text, "ranking");
        if (ranking == null) {
            throw new IllegalArgumentException("Could not find a <ranking> tag.");
        }
        List<Integer> rankedIds = new ArrayList<>();
        Matcher matcher = RANK.matcher(ranking);
        while (matcher.find()) {
            rankedIds.add(Integer.parseInt(matcher.group(1)));
        }
        if (rankedIds.isEmpty()) {
            throw new IllegalArgumentException(
                    "Found <ranking> tag, but no valid <rank> tags inside.");
        }
        int topId = rankedIds.get(0);
        RoundResponse top = byId(responses, topId);
        if (top == null) {
            throw new IllegalArgumentException("Top-ranked response ID " + topId + " not found.");
        }
        return new SynthesisResult(
                top.answer(),
                1.0,
                "Arbiter ranked all responses. Top choice is #"
                        + topId
                        + " from '"
                        + top.agentIdentifier()
                        + "'. Full ranking: "
                        + rankedIds,
                false,
                List.of(),
                "",
                text,
                null,
                rankedIds);
    }

    private static RoundResponse byId(List<RoundResponse> responses, int id) {
        return id >= 1 && id <= responses.size() ? responses.get(id - 1) : null;
    }

    private static List<String> refinementAreas(String block) {
        if (block == null || block.isBlank()) {
            return List.of();
        }
        List<String> areas = TagUtil.extractAll(block, "area");
        if (!areas.isEmpty()) {
            return areas;
        }
        return block.lines()
                .map(line -> line.strip().replaceFirst("^[-*\\u2022]\\s*", ""))
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
