package com.airbrief.content.summary;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code Headline:} / {@code Description:} reply format. A reply with neither line
 * is unusable; a reply missing one of them gets the default for that field.
 */
final class SummaryParser {
    static final int MAX_HEADLINE_CHARS = 60;

    private static final Pattern HEADLINE = Pattern.compile("(?im)^\\s*headline:\\s*(.+?)\\s*$");
    private static final Pattern DESCRIPTION = Pattern.compile("(?im)^\\s*description:\\s*(.+?)\\s*$");
    private static final String ELLIPSIS = "...";

    private SummaryParser() {
    }

    static Optional<LocationSummary> parse(String raw, int maxDescriptionChars) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Optional<String> headline = field(HEADLINE, raw);
        Optional<String> description = field(DESCRIPTION, raw);
        if (headline.isEmpty() && description.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LocationSummary(
                truncate(headline.orElse(LocationSummary.DEFAULT_HEADLINE), MAX_HEADLINE_CHARS),
                truncate(description.orElse(LocationSummary.DEFAULT_DESCRIPTION), maxDescriptionChars)
        ));
    }

    private static Optional<String> field(Pattern pattern, String raw) {
        Matcher matcher = pattern.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = unquote(matcher.group(1).trim());
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    private static String truncate(String value, int maxChars) {
        if (value.length() <= maxChars) {
            return value;
        }
        int cut = maxChars - ELLIPSIS.length();
        if (Character.isHighSurrogate(value.charAt(cut - 1))) {
            cut--;
        }
        return value.substring(0, cut) + ELLIPSIS;
    }
}
