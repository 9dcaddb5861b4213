package io.consortium.core.parse;

/// Structured fields recovered from one raw reply.
///
/// @param reasoning content of `<reasoning>`, null when absent
/// @param answer content of `<answer>`, or the whole reply when that tag is absent
/// @param confidence self-reported confidence in [0, 1], null when absent or unusable
public record ParsedResponse(String reasoning, String answer, Double confidence) {}
