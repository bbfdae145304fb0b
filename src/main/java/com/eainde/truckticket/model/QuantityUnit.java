package com.eainde.truckticket.model;

import java.util.Locale;
import java.util.Optional;

public enum QuantityUnit {
    TONS,
    CY,
    LOADS;

    /**
     * Maps a unit token as printed on a ticket ("TON", "Cubic Yards", "LOADS") to a unit.
     */
    public static Optional<QuantityUnit> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String t = token.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        switch (t) {
            case "TON":
            case "TONS":
            case "TN":
                return Optional.of(TONS);
            case "CY":
            case "YD":
            case "YDS":
            case "CUBIC YARD":
            case "CUBIC YARDS":
                return Optional.of(CY);
            case "LOAD":
            case "LOADS":
                return Optional.of(LOADS);
            default:
                return Optional.empty();
        }
    }
}
