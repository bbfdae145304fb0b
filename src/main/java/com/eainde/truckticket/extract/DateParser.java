package com.eainde.truckticket.extract;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the date layouts printed on hauling tickets. Parsing is strict: "02/30/2024"
 * is rejected rather than rolled over.
 */
public final class DateParser {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("M/d/uuuu"),
            formatter("M-d-uuuu"),
            formatter("uuuu-M-d"),
            formatter("M/d/uu"),
            formatter("M-d-uu"),
            formatter("d-MMM-uuuu"),
            formatter("d-MMMM-uuuu"),
            formatter("d MMM uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu"));

    private DateParser() {}

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim().replaceAll("\\s+", " ").replaceAll("[.]$", "");
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
