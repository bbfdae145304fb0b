package com.eainde.truckticket.extract;

import com.eainde.truckticket.model.QuantityUnit;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a number and its unit from a raw quantity such as {@code "18.50 TONS"} or {@code "12 CY"}.
 */
public final class QuantityParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|-?\\d+(?:\\.\\d+)?");
    private static final Pattern UNIT = Pattern.compile(
            "\\b(CUBIC\\s+YARDS?|TONS?|TN|CY|YDS?|LOADS?)\\b", Pattern.CASE_INSENSITIVE);

    private QuantityParser() {}

    public static Optional<Quantity> parse(String raw, QuantityUnit defaultUnit) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher number = NUMBER.matcher(raw);
        if (!number.find()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(number.group().replace(",", ""));
        Matcher unit = UNIT.matcher(raw);
        QuantityUnit parsedUnit = unit.find()
                ? QuantityUnit.fromToken(unit.group(1)).orElse(defaultUnit)
                : defaultUnit;
        return Optional.of(new Quantity(value, parsedUnit));
    }
}
