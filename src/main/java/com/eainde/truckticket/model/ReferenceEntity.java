package com.eainde.truckticket.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A row of one of the reference tables (job, material, source, destination, vendor, ticket type).
 *
 * @param id               stable identifier
 * @param category         which table the entity belongs to
 * @param canonicalName    unique name inside its category
 * @param requiresManifest for materials and destinations: tickets need a manifest number
 */
public record ReferenceEntity(
        @JsonProperty("id")                long id,
        @JsonProperty("category")          ReferenceCategory category,
        @JsonProperty("canonical_name")    String canonicalName,
        @JsonProperty("requires_manifest") boolean requiresManifest
) {
    public ReferenceEntity {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(canonicalName, "canonicalName");
    }

    public static ReferenceEntity of(long id, ReferenceCategory category, String canonicalName) {
        return new ReferenceEntity(id, category, canonicalName, false);
    }
}
