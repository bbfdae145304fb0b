package com.eainde.truckticket.normalize;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw OCR spellings to canonical names using a static table.
 *
 * <p>Lookup order, all case-insensitive on the trimmed input:</p>
 * <ol>
 *   <li>the input already is a canonical name of the category;</li>
 *   <li>the input equals a raw term;</li>
 *   <li>the input contains a raw term (longest term wins).</li>
 * </ol>
 * <p>Anything else is returned unmodified. Canonical names always map to themselves,
 * so normalizing twice gives the same result as normalizing once.</p>
 *
 * <h3>Table format (YAML):</h3>
 * <pre>
 * vendors:
 *   "WM LEWISVILLE": WASTE_MANAGEMENT_LEWISVILLE
 * materials:
 *   "CLASS 2": CLASS_2_CONTAMINATED
 * </pre>
 */
@Slf4j
public final class SynonymNormalizer {

    private final Map<SynonymCategory, Map<String, String>> exact = new EnumMap<>(SynonymCategory.class);
    private final Map<SynonymCategory, List<String>> termsByLength = new EnumMap<>(SynonymCategory.class);
    private final Map<SynonymCategory, Map<String, String>> canonicals = new EnumMap<>(SynonymCategory.class);

    public SynonymNormalizer(Map<SynonymCategory, Map<String, String>> table) {
        for (SynonymCategory category : SynonymCategory.values()) {
            Map<String, String> raw = table.getOrDefault(category, Map.of());
            Map<String, String> byKey = new LinkedHashMap<>();
            Map<String, String> canon = new LinkedHashMap<>();
            raw.forEach((term, canonical) -> {
                byKey.put(key(term), canonical);
                canon.put(key(canonical), canonical);
            });
            exact.put(category, byKey);
            canonicals.put(category, canon);
            termsByLength.put(category, byKey.keySet().stream()
                    .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                    .toList());
        }
    }

    public static SynonymNormalizer empty() {
        return new SynonymNormalizer(Map.of());
    }

    public static SynonymNormalizer load(InputStream in) {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        try {
            Map<String, Map<String, String>> raw =
                    yaml.readValue(in, new TypeReference<Map<String, Map<String, String>>>() {});
            Map<SynonymCategory, Map<String, String>> table = new EnumMap<>(SynonymCategory.class);
            if (raw != null) {
                raw.forEach((section, terms) -> table.put(SynonymCategory.fromSection(section), terms));
            }
            SynonymNormalizer normalizer = new SynonymNormalizer(table);
            log.info("Loaded synonym table: {}", normalizer.describe());
            return normalizer;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load synonym table", e);
        }
    }

    /**
     * @return the canonical name, or {@code raw} unchanged when nothing maps; null stays null
     */
    public String normalize(String raw, SynonymCategory category) {
        if (raw == null) {
            return null;
        }
        String key = key(raw);
        if (key.isEmpty()) {
            return raw;
        }
        String canonical = canonicals.get(category).get(key);
        if (canonical != null) {
            return canonical;
        }
        canonical = exact.get(category).get(key);
        if (canonical != null) {
            return canonical;
        }
        for (String term : termsByLength.get(category)) {
            if (key.contains(term)) {
                return exact.get(category).get(term);
            }
        }
        return raw;
    }

    /**
     * @return true when {@code raw} normalizes to a canonical name of the category
     */
    public boolean isMapped(String raw, SynonymCategory category) {
        String normalized = normalize(raw, category);
        return normalized != null && canonicals.get(category).containsKey(key(normalized));
    }

    private String describe() {
        Set<String> parts = new HashSet<>();
        exact.forEach((c, m) -> parts.add(c + "=" + m.size()));
        return String.join(", ", parts);
    }

    private static String key(String s) {
        return s.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
