package com.eainde.truckticket.extract;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Values encoded in a structured file name
 * {@code {JOB}__{DATE}__{AREA}__{FLOW}__{MATERIAL}__{VENDOR}.pdf}. Any part that is absent
 * or malformed is null; parsing never fails.
 */
public record FilenameHints(String job, LocalDate date, String area, String flow, String material, String vendor) {

    private static final String DELIMITER = "__";
    private static final Pattern JOB_CODE = Pattern.compile("^\\d{2}-\\d{3}$");

    public static final FilenameHints NONE = new FilenameHints(null, null, null, null, null, null);

    public static FilenameHints parse(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String[] parts = stem.split(DELIMITER, -1);
        if (parts.length < 2) {
            return NONE;
        }
        return new FilenameHints(
                JOB_CODE.matcher(parts[0].trim()).matches() ? parts[0].trim() : null,
                parseDate(parts[1]),
                part(parts, 2, false),
                part(parts, 3, true),
                part(parts, 4, true),
                part(parts, 5, true));
    }

    public boolean isEmpty() {
        return this.equals(NONE);
    }

    private static String part(String[] parts, int index, boolean upper) {
        if (parts.length <= index || parts[index].isBlank()) {
            return null;
        }
        String value = parts[index].trim();
        return upper ? value.toUpperCase(Locale.ROOT) : value;
    }

    private static LocalDate parseDate(String value) {
        try {
            LocalDate date = LocalDate.parse(value.trim());
            return date.getYear() >= 2020 && date.getYear() <= 2030 ? date : null;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
