package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.BoundingBox;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Detection terms and field rules of one vendor's ticket layout.
 *
 * @param vendorName    canonical vendor name, also the key into the vendor reference table
 * @param aliases       alternative spellings, matched like {@code matchTerms}
 * @param matchTerms    any of these on the page suggests this vendor
 * @param excludeTerms  any of these on the page rules this vendor out
 * @param logoRef       logo image file name, null when the vendor has no logo
 * @param logoThreshold minimum correlation score for a logo hit
 * @param logoRoi       page region the logo is searched in
 * @param fields        field name to rule
 */
public record VendorTemplate(
        String vendorName,
        List<String> aliases,
        List<String> matchTerms,
        List<String> excludeTerms,
        String logoRef,
        double logoThreshold,
        BoundingBox logoRoi,
        Map<String, FieldRule> fields
) {
    public static final String DEFAULT_NAME = "DEFAULT";

    public VendorTemplate {
        Objects.requireNonNull(vendorName, "vendorName");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        matchTerms = matchTerms == null ? List.of() : List.copyOf(matchTerms);
        excludeTerms = excludeTerms == null ? List.of() : List.copyOf(excludeTerms);
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public boolean isDefault() {
        return DEFAULT_NAME.equalsIgnoreCase(vendorName);
    }

    public Optional<FieldRule> rule(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /** Match terms followed by aliases, the full list of literals used for keyword detection. */
    public List<String> detectionTerms() {
        return Stream.concat(matchTerms.stream(), aliases.stream()).toList();
    }
}
