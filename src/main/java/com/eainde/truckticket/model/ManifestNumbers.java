package com.eainde.truckticket.model;

import java.util.regex.Pattern;

/**
 * Format rules for manifest numbers: 6 to 20 letters or digits, optionally grouped by
 * single hyphens ({@code WM-MAN-2024-001234}).
 */
public final class ManifestNumbers {

    private static final Pattern WELL_FORMED =
            Pattern.compile("^(?=.{6,20}$)[A-Z0-9]+(?:-[A-Z0-9]+)*$", Pattern.CASE_INSENSITIVE);

    private ManifestNumbers() {}

    public static boolean isWellFormed(String manifestNumber) {
        return manifestNumber != null && WELL_FORMED.matcher(manifestNumber).matches();
    }
}
