package com.eainde.truckticket.model;

public enum RunStatus {
    IN_PROGRESS,
    COMPLETED,
    /** At least one file ended in ERROR while others succeeded. */
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
