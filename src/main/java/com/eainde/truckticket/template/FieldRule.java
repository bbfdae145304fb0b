package com.eainde.truckticket.template;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * How one field is read for one vendor: a primary method, an optional fallback applied
 * only when the primary yields nothing valid, and an optional validation pattern.
 */
public record FieldRule(String field, ExtractionMethod primary, ExtractionMethod fallback, Pattern validation) {

    public FieldRule {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(primary, "primary");
    }

    public Optional<ExtractionMethod> fallbackMethod() {
        return Optional.ofNullable(fallback);
    }

    public boolean accepts(String value) {
        return validation == null || validation.matcher(value).matches();
    }
}
