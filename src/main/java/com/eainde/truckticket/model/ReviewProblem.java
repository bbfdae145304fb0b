package com.eainde.truckticket.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single problem found while processing one page.
 *
 * @param reason the review reason; its severity is fixed by the reason
 * @param field  affected field name, null for page-level problems
 * @param detail operator-facing description
 */
public record ReviewProblem(
        @JsonProperty("reason") ReviewReason reason,
        @JsonProperty("field")  String field,
        @JsonProperty("detail") String detail
) {
    public ReviewProblem {
        Objects.requireNonNull(reason, "reason");
    }

    public static ReviewProblem of(ReviewReason reason, String field, String detail) {
        return new ReviewProblem(reason, field, detail);
    }

    @JsonIgnore
    public Severity severity() {
        return reason.severity();
    }
}
