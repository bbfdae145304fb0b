package com.eainde.truckticket.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured hint shown to the operator next to a review entry.
 */
public record SuggestedFix(
        @JsonProperty("action")  String action,
        @JsonProperty("details") Map<String, Object> details
) {
    public SuggestedFix {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SuggestedFix of(String action) {
        return new SuggestedFix(action, Map.of());
    }
}
