package com.eainde.truckticket.processor;

import com.eainde.truckticket.reference.ReferenceDataCache;

import java.util.Objects;

/**
 * State shared by all files of one batch run.
 */
public record RunContext(String requestGuid, ReferenceDataCache references, CancellationToken cancellation) {

    public RunContext {
        Objects.requireNonNull(requestGuid, "requestGuid");
        Objects.requireNonNull(references, "references");
        Objects.requireNonNull(cancellation, "cancellation");
    }
}
