package io.consortium.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Lenient extraction of `<tag>...</tag>` segments from model output.
///
/// Model replies are free text that only loosely follows the requested markup, so
/// nothing here validates structure: tag names match case-insensitively, content may
/// span lines, and the first occurrence wins.
public final class TagUtil {

    private static final Pattern NUMBER = Pattern.compile("(-?\\d*\\.?\\d+)\\s*(%?)");

    private TagUtil() {}

    /// Extract the trimmed content of the first `<tag>` element.
    ///
    /// @return the content, or null when the tag is absent
    public static String extractTag(String text, String tag) {
        if (text == null) {
            return null;
        }
        Matcher matcher = tagPattern(tag).matcher(text);
        return matcher.find() ? matcher.group(1).strip() : null;
    }

    /// Extract the trimmed, non-blank contents of every `<tag>` element, in order.
    public static List<String> extractAll(String text, String tag) {
        List<String> values = new ArrayList<>();
        if (text == null) {
            return values;
        }
        Matcher matcher = tagPattern(tag).matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1).strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    /// Read a confidence value such as `0.85`, `85` or `85%`.
    ///
    /// Values above 1 are percentages. Anything still outside [0, 1] after that
    /// conversion is rejected.
    ///
    /// @return the confidence in [0, 1], or null if the text holds no usable number
    public static Double parseConfidence(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (value > 1.0 || !matcher.group(2).isEmpty()) {
            value = value / 100.0;
        }
        return value >= 0.0 && value <= 1.0 ? value : null;
    }

    private static Pattern tagPattern(String tag) {
        return Pattern.compile(
                "<" + Pattern.quote(tag) + ">([\\s\\S]*?)</" + Pattern.quote(tag) + ">",
                Pattern.CASE_INSENSITIVE);
    }
}
