package com.eainde.truckticket.processor;

import com.eainde.truckticket.model.QuantityUnit;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * Defaults and thresholds applied while building and checking a ticket.
 *
 * @param defaultJob             job code used when the file name carries none
 * @param defaultTicketType      IMPORT or EXPORT when the file name carries no flow
 * @param defaultMaterial        material used when neither file name nor page name one
 * @param defaultQuantityUnit    unit assumed when the quantity has none
 * @param lowConfidenceThreshold aggregated confidence below which a page is flagged
 * @param earliestTicketDate     dates before this are out of range
 * @param maxFutureDays          dates more than this many days after today are out of range
 * @param unusualQuantityLimits  upper bound per unit; quantities above it are flagged
 */
@Builder(toBuilder = true)
public record ProcessingPolicy(
        String defaultJob,
        String defaultTicketType,
        String defaultMaterial,
        QuantityUnit defaultQuantityUnit,
        double lowConfidenceThreshold,
        LocalDate earliestTicketDate,
        int maxFutureDays,
        Map<QuantityUnit, BigDecimal> unusualQuantityLimits
) {
    public ProcessingPolicy {
        Objects.requireNonNull(defaultTicketType, "defaultTicketType");
        Objects.requireNonNull(defaultMaterial, "defaultMaterial");
        Objects.requireNonNull(defaultQuantityUnit, "defaultQuantityUnit");
        Objects.requireNonNull(earliestTicketDate, "earliestTicketDate");
        unusualQuantityLimits = unusualQuantityLimits == null ? Map.of() : Map.copyOf(unusualQuantityLimits);
    }

    public static ProcessingPolicy defaults() {
        return ProcessingPolicy.builder()
                .defaultJob("24-105")
                .defaultTicketType("EXPORT")
                .defaultMaterial("CLASS_2_CONTAMINATED")
                .defaultQuantityUnit(QuantityUnit.TONS)
                .lowConfidenceThreshold(0.60)
                .earliestTicketDate(LocalDate.of(2020, 1, 1))
                .maxFutureDays(7)
                .unusualQuantityLimits(Map.of(
                        QuantityUnit.TONS, new BigDecimal("50"),
                        QuantityUnit.CY, new BigDecimal("40"),
                        QuantityUnit.LOADS, new BigDecimal("10")))
                .build();
    }
}
