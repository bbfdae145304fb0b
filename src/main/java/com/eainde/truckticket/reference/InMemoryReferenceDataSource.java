package com.eainde.truckticket.reference;

import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference tables held in memory, seeded from YAML.
 *
 * <pre>
 * MATERIAL:
 *   - { id: 1, canonical_name: CLASS_2_CONTAMINATED, requires_manifest: true }
 *   - { id: 2, canonical_name: NON_CONTAMINATED }
 * </pre>
 */
@Slf4j
public class InMemoryReferenceDataSource implements ReferenceDataSource {

    private final Map<String, ReferenceEntity> byKey = new ConcurrentHashMap<>();

    public InMemoryReferenceDataSource(Collection<ReferenceEntity> entities) {
        entities.forEach(this::add);
    }

    public static InMemoryReferenceDataSource load(InputStream in) {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        try {
            Map<ReferenceCategory, List<SeedRow>> tables =
                    yaml.readValue(in, new TypeReference<Map<ReferenceCategory, List<SeedRow>>>() {});
            List<ReferenceEntity> entities = new ArrayList<>();
            tables.forEach((category, rows) -> rows.forEach(r ->
                    entities.add(new ReferenceEntity(r.id(), category, r.canonicalName(), r.requiresManifest()))));
            log.info("Seeded {} reference entities", entities.size());
            return new InMemoryReferenceDataSource(entities);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load reference seed data", e);
        }
    }

    public final void add(ReferenceEntity entity) {
        ReferenceEntity previous = byKey.putIfAbsent(key(entity.category(), entity.canonicalName()), entity);
        if (previous != null && !previous.equals(entity)) {
            throw new IllegalArgumentException("Duplicate " + entity.category() + " reference " + entity.canonicalName());
        }
    }

    @Override
    public Optional<ReferenceEntity> findByName(ReferenceCategory category, String canonicalName) {
        if (canonicalName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key(category, canonicalName)));
    }

    @Override
    public List<ReferenceEntity> findAll(ReferenceCategory category) {
        return byKey.values().stream().filter(e -> e.category() == category).toList();
    }

    private static String key(ReferenceCategory category, String name) {
        return category + ":" + name.trim().toUpperCase(Locale.ROOT);
    }

    record SeedRow(
            @JsonProperty("id")                long id,
            @JsonProperty("canonical_name")    String canonicalName,
            @JsonProperty("requires_manifest") boolean requiresManifest
    ) {}
}
