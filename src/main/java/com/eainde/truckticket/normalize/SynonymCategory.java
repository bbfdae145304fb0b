package com.eainde.truckticket.normalize;

import java.util.Locale;

public enum SynonymCategory {
    VENDOR,
    SOURCE,
    DESTINATION,
    MATERIAL;

    /**
     * Accepts table section names in singular or plural form ("vendors", "MATERIAL").
     */
    public static SynonymCategory fromSection(String section) {
        String s = section.trim().toUpperCase(Locale.ROOT);
        if (s.endsWith("S")) {
            s = s.substring(0, s.length() - 1);
        }
        return valueOf(s);
    }
}
