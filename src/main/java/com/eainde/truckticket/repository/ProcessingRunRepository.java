package com.eainde.truckticket.repository;

import com.eainde.truckticket.model.ProcessingRun;

import java.util.Optional;

public interface ProcessingRunRepository {

    void insert(ProcessingRun run);

    /**
     * Replaces the stored state of a run that is still in progress.
     *
     * @throws IllegalStateException if the stored run is already sealed
     */
    void update(ProcessingRun run);

    Optional<ProcessingRun> find(String requestGuid);
}
