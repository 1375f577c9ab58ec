package io.layoffs.cleaning;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Parses event dates with one fixed pattern. Anything that does not match, including impossible
 * calendar dates such as 2/30/2023, comes back as null.
 */
public final class LayoffDateParser {
    public static final String DEFAULT_PATTERN = "M/d/uuuu";

    private final String pattern;
    private final DateTimeFormatter formatter;

    public LayoffDateParser() {
        this(DEFAULT_PATTERN);
    }

    /**
     * @param pattern a {@link DateTimeFormatter} pattern; {@code yyyy} is read as {@code uuuu} because
     *                strict resolution has no era to combine a year-of-era with
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public LayoffDateParser(String pattern) {
        this.pattern = pattern;
        this.formatter = DateTimeFormatter.ofPattern(pattern.replace("yyyy", "uuuu"))
                .withResolverStyle(ResolverStyle.STRICT);
    }

    public LocalDate parse(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (t.isEmpty()) return null;
        try {
            LocalDate d = LocalDate.parse(t, formatter);
            // four-digit years only
            if (d.getYear() < 1000 || d.getYear() > 9999) return null;
            return d;
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public String pattern() { return pattern; }
}
