package com.eainde.truckticket.template;

import com.eainde.truckticket.exception.TemplateValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of vendor templates keyed by upper-cased vendor name, always including
 * the {@value VendorTemplate#DEFAULT_NAME} template.
 */
public final class VendorTemplateCatalog {

    private final Map<String, VendorTemplate> byName;
    private final VendorTemplate defaultTemplate;

    public VendorTemplateCatalog(Collection<VendorTemplate> templates) {
        Map<String, VendorTemplate> map = new LinkedHashMap<>();
        for (VendorTemplate t : templates) {
            map.put(key(t.vendorName()), t);
        }
        this.defaultTemplate = map.remove(VendorTemplate.DEFAULT_NAME);
        if (defaultTemplate == null) {
            throw new TemplateValidationException("catalog", List.of("a DEFAULT template is required"));
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public VendorTemplate defaultTemplate() {
        return defaultTemplate;
    }

    /** Vendor templates, excluding DEFAULT, in declaration order. */
    public Collection<VendorTemplate> vendors() {
        return byName.values();
    }

    public Optional<VendorTemplate> find(String vendorName) {
        return vendorName == null ? Optional.empty() : Optional.ofNullable(byName.get(key(vendorName)));
    }

    /**
     * The vendor's rule for a field, else the DEFAULT template's rule.
     */
    public Optional<FieldRule> ruleFor(String vendorName, String field) {
        return find(vendorName)
                .flatMap(t -> t.rule(field))
                .or(() -> defaultTemplate.rule(field));
    }

    public int size() {
        return byName.size();
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
