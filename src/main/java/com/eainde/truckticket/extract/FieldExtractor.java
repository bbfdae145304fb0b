package com.eainde.truckticket.extract;

import com.eainde.truckticket.ocr.OcrPage;
import com.eainde.truckticket.template.ExtractionMethod;
import com.eainde.truckticket.template.FieldRule;
import com.eainde.truckticket.template.Match;
import com.eainde.truckticket.template.VendorTemplateCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies vendor template rules to one page.
 *
 * <p>For each field the vendor's rule is used, or the DEFAULT template's rule when the
 * vendor is unknown or does not define the field. The fallback method runs only when the
 * primary method produced no match that passes {@code validation_regex}. Among several
 * valid matches the one with the longest run of digits wins, then the earliest in reading
 * order.</p>
 */
@Slf4j
public class FieldExtractor {

    static final Comparator<Match> PREFERENCE = Comparator
            .comparingInt((Match m) -> longestDigitRun(m.value())).reversed()
            .thenComparingInt(Match::order);

    private final VendorTemplateCatalog catalog;

    public FieldExtractor(VendorTemplateCatalog catalog) {
        this.catalog = catalog;
    }

    public ExtractedField extract(OcrPage page, String vendorName, String field) {
        Optional<FieldRule> rule = catalog.ruleFor(vendorName, field);
        if (rule.isEmpty()) {
            return ExtractedField.missing(field);
        }
        FieldRule r = rule.get();
        Optional<ExtractedField> primary = select(r, r.primary(), page);
        if (primary.isPresent()) {
            return primary.get();
        }
        Optional<ExtractedField> fallback = r.fallbackMethod().flatMap(m -> select(r, m, page));
        if (fallback.isPresent()) {
            log.debug("Field {} for vendor {} read by fallback {}", field, vendorName, fallback.get().method());
        }
        return fallback.orElseGet(() -> ExtractedField.missing(field));
    }

    /**
     * Extracts every field in {@link FieldNames#EXTRACTED}, preserving that order.
     */
    public Map<String, ExtractedField> extractAll(OcrPage page, String vendorName) {
        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        for (String field : FieldNames.EXTRACTED) {
            fields.put(field, extract(page, vendorName, field));
        }
        return fields;
    }

    private static Optional<ExtractedField> select(FieldRule rule, ExtractionMethod method, OcrPage page) {
        List<Match> matches = method.find(page);
        return matches.stream()
                .filter(m -> rule.accepts(m.value()))
                .min(PREFERENCE)
                .map(m -> new ExtractedField(rule.field(), m.value(), clamp(m.confidence()), method.methodName()));
    }

    static int longestDigitRun(String value) {
        int best = 0;
        int run = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                run++;
                best = Math.max(best, run);
            } else {
                run = 0;
            }
        }
        return best;
    }

    private static double clamp(double c) {
        return Math.max(0.0, Math.min(1.0, c));
    }
}
