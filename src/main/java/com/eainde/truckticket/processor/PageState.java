package com.eainde.truckticket.processor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-page processing states. A page that loses a commit race moves from
 * COMMITTING to QUEUED.
 */
public enum PageState {
    EXTRACTING,
    VALIDATING,
    COMMITTING,
    QUEUED;

    Set<PageState> successors() {
        switch (this) {
            case EXTRACTING:
                return EnumSet.of(VALIDATING);
            case VALIDATING:
                return EnumSet.of(COMMITTING, QUEUED);
            case COMMITTING:
                return EnumSet.of(QUEUED);
            default:
                return EnumSet.noneOf(PageState.class);
        }
    }
}
