package com.eainde.truckticket.model;

/**
 * Review severity, declared in ascending order so that {@link #max(Severity, Severity)}
 * can compare ordinals.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * @return true if a page carrying a problem of this severity must not be committed
     */
    public boolean blocksCommit() {
        return this != INFO;
    }
}
