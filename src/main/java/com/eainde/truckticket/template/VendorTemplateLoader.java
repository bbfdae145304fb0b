package com.eainde.truckticket.template;

import com.eainde.truckticket.exception.TemplateValidationException;
import com.eainde.truckticket.ocr.BoundingBox;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads vendor templates from YAML and turns them into validated {@link VendorTemplate}s.
 *
 * <p>Every template and field is checked before anything is returned: unknown methods,
 * missing regions or labels, regions outside [0,1] and patterns that do not compile are
 * all reported together in one {@link TemplateValidationException}.</p>
 *
 * <h3>Format:</h3>
 * <pre>
 * templates:
 *   - vendor_name: LDI_YARD
 *     aliases: [LDI]
 *     match_terms: [LDI YARD]
 *     exclude_terms: []
 *     logo_ref: ldi.png
 *     fields:
 *       ticket_number:
 *         method: roi_regex          # roi_regex | label_right | text_regex
 *         roi: [0.6, 0.1, 1.0, 0.3]
 *         label: [TICKET, TKT]
 *         regex: '(\d{5,8})'
 *         regex_flags: [IGNORECASE]
 *         validation_regex: '^\d{5,8}$'
 *         fallback_method: below_label   # below_label | text_regex
 *         fallback_regex: '(\d{5,8})'
 * </pre>
 */
@Slf4j
public class VendorTemplateLoader {

    static final double DEFAULT_LOGO_THRESHOLD = 0.85;
    static final BoundingBox DEFAULT_LOGO_ROI = BoundingBox.of(0.0, 0.0, 0.5, 0.25);

    private final ObjectMapper yamlMapper;
    private final double defaultLogoThreshold;

    public VendorTemplateLoader() {
        this(DEFAULT_LOGO_THRESHOLD);
    }

    /**
     * @param defaultLogoThreshold NCC score a logo must reach when its template sets no
     *                             {@code logo_threshold}
     */
    public VendorTemplateLoader(double defaultLogoThreshold) {
        if (defaultLogoThreshold <= 0.0 || defaultLogoThreshold > 1.0) {
            throw new IllegalArgumentException("defaultLogoThreshold must be in (0, 1]");
        }
        this.defaultLogoThreshold = defaultLogoThreshold;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }

    public VendorTemplateCatalog load(InputStream in, String sourceName) {
        TemplateFile file;
        try {
            file = yamlMapper.readValue(in, TemplateFile.class);
        } catch (IOException e) {
            throw new TemplateValidationException(sourceName, e);
        }
        if (file == null || file.templates() == null || file.templates().isEmpty()) {
            throw new TemplateValidationException(sourceName, List.of("no templates declared"));
        }

        List<String> errors = new ArrayList<>();
        List<VendorTemplate> templates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < file.templates().size(); i++) {
            TemplateSpec spec = file.templates().get(i);
            String where = spec.vendorName() == null ? "templates[" + i + "]" : spec.vendorName();
            if (spec.vendorName() == null || spec.vendorName().isBlank()) {
                errors.add(where + ": vendor_name is required");
                continue;
            }
            if (!seen.add(spec.vendorName().trim().toUpperCase(Locale.ROOT))) {
                errors.add(where + ": declared more than once");
                continue;
            }
            templates.add(toTemplate(spec, where, errors));
        }
        if (!seen.contains(VendorTemplate.DEFAULT_NAME)) {
            errors.add("a DEFAULT template is required");
        }
        if (!errors.isEmpty()) {
            throw new TemplateValidationException(sourceName, errors);
        }

        VendorTemplateCatalog catalog = new VendorTemplateCatalog(templates);
        log.info("Loaded {} vendor templates (+DEFAULT) from {}", catalog.size(), sourceName);
        return catalog;
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    private VendorTemplate toTemplate(TemplateSpec spec, String where, List<String> errors) {
        double threshold = spec.logoThreshold() == null ? defaultLogoThreshold : spec.logoThreshold();
        if (threshold <= 0.0 || threshold > 1.0) {
            errors.add(where + ": logo_threshold must be in (0, 1]");
        }
        BoundingBox logoRoi = spec.logoRoi() == null
                ? DEFAULT_LOGO_ROI
                : toBox(spec.logoRoi(), where + ".logo_roi", errors);

        Map<String, FieldRule> rules = new LinkedHashMap<>();
        if (spec.fields() != null) {
            spec.fields().forEach((field, fieldSpec) -> {
                FieldRule rule = toRule(field, fieldSpec, where + ".fields." + field, errors);
                if (rule != null) {
                    rules.put(field, rule);
                }
            });
        }
        return new VendorTemplate(spec.vendorName().trim(), lower(spec.aliases()), lower(spec.matchTerms()),
                lower(spec.excludeTerms()), spec.logoRef(), threshold, logoRoi, rules);
    }

    private FieldRule toRule(String field, FieldSpec spec, String where, List<String> errors) {
        int before = errors.size();
        if (spec == null) {
            errors.add(where + ": empty field definition");
            return null;
        }
        int flags = toFlags(spec.regexFlags(), where, errors);
        Pattern regex = compile(spec.regex(), flags, where + ".regex", errors, true);
        Pattern validation = compile(spec.validationRegex(), 0, where + ".validation_regex", errors, false);
        List<String> labels = spec.label() == null ? List.of() : spec.label();
        BoundingBox roi = spec.roi() == null ? null : toBox(spec.roi(), where + ".roi", errors);

        String method = spec.method() == null ? null : spec.method().trim().toLowerCase(Locale.ROOT);
        if (method == null) {
            errors.add(where + ": method is required");
        } else if ("roi_regex".equals(method) && roi == null) {
            errors.add(where + ": roi_regex needs roi");
        } else if ("label_right".equals(method) && labels.isEmpty()) {
            errors.add(where + ": label_right needs label");
        } else if (!Set.of("roi_regex", "label_right", "text_regex").contains(method)) {
            errors.add(where + ": unknown method '" + spec.method() + "'");
        }

        Pattern fallbackRegex = spec.fallbackRegex() == null
                ? regex
                : compile(spec.fallbackRegex(), flags, where + ".fallback_regex", errors, true);
        String fallbackMethod = spec.fallbackMethod() == null ? null : spec.fallbackMethod().trim().toLowerCase(Locale.ROOT);
        if (fallbackMethod != null && !Set.of("below_label", "text_regex").contains(fallbackMethod)) {
            errors.add(where + ": unknown fallback_method '" + spec.fallbackMethod() + "'");
        } else if ("below_label".equals(fallbackMethod) && roi == null && labels.isEmpty()) {
            errors.add(where + ": below_label fallback needs roi or label to anchor on");
        }
        if (spec.fallbackRegex() != null && fallbackMethod == null) {
            errors.add(where + ": fallback_regex given without fallback_method");
        }

        if (errors.size() > before) {
            return null;
        }

        ExtractionMethod primary;
        switch (method) {
            case "roi_regex":
                primary = new RoiRegex(roi, labels, regex);
                break;
            case "label_right":
                primary = new LabelRight(labels, regex);
                break;
            default:
                primary = new TextRegex(regex);
        }
        ExtractionMethod fallback = null;
        if ("below_label".equals(fallbackMethod)) {
            fallback = new BelowLabel(roi, labels, fallbackRegex);
        } else if ("text_regex".equals(fallbackMethod)) {
            fallback = new TextRegex(fallbackRegex);
        }
        return new FieldRule(field, primary, fallback, validation);
    }

    private static Pattern compile(String regex, int flags, String where, List<String> errors, boolean required) {
        if (regex == null || regex.isEmpty()) {
            if (required) {
                errors.add(where + " is required");
            }
            return null;
        }
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            errors.add(where + " does not compile: " + e.getDescription());
            return null;
        }
    }

    private static int toFlags(List<String> names, String where, List<String> errors) {
        int flags = 0;
        if (names == null) {
            return flags;
        }
        for (String name : names) {
            switch (name.trim().toUpperCase(Locale.ROOT)) {
                case "IGNORECASE":
                case "I":
                    flags |= Pattern.CASE_INSENSITIVE;
                    break;
                case "MULTILINE":
                case "M":
                    flags |= Pattern.MULTILINE;
                    break;
                case "DOTALL":
                case "S":
                    flags |= Pattern.DOTALL;
                    break;
                default:
                    errors.add(where + ": unknown regex flag '" + name + "'");
            }
        }
        return flags;
    }

    private static BoundingBox toBox(List<Double> values, String where, List<String> errors) {
        if (values.size() != 4) {
            errors.add(where + ": expected [x0, y0, x1, y1], got " + values.size() + " values");
            return null;
        }
        try {
            BoundingBox box = new BoundingBox(values.get(0), values.get(1), values.get(2), values.get(3));
            if (box.width() == 0 || box.height() == 0) {
                errors.add(where + ": region is empty");
                return null;
            }
            return box;
        } catch (IllegalArgumentException e) {
            errors.add(where + ": " + e.getMessage());
            return null;
        }
    }

    private static List<String> lower(List<String> terms) {
        return terms == null ? List.of() : terms.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    }

    // =========================================================================
    //  YAML shape
    // =========================================================================

    record TemplateFile(@JsonProperty("templates") List<TemplateSpec> templates) {}

    record TemplateSpec(
            @JsonProperty("vendor_name")    String vendorName,
            @JsonProperty("aliases")        List<String> aliases,
            @JsonProperty("match_terms")    List<String> matchTerms,
            @JsonProperty("exclude_terms")  List<String> excludeTerms,
            @JsonProperty("logo_ref")       String logoRef,
            @JsonProperty("logo_threshold") Double logoThreshold,
            @JsonProperty("logo_roi")       List<Double> logoRoi,
            @JsonProperty("fields")         Map<String, FieldSpec> fields
    ) {}

    record FieldSpec(
            @JsonProperty("method")           String method,
            @JsonProperty("roi")              List<Double> roi,
            @JsonProperty("label")            List<String> label,
            @JsonProperty("regex")            String regex,
            @JsonProperty("regex_flags")      List<String> regexFlags,
            @JsonProperty("validation_regex") String validationRegex,
            @JsonProperty("fallback_method")  String fallbackMethod,
            @JsonProperty("fallback_regex")   String fallbackRegex
    ) {}
}
