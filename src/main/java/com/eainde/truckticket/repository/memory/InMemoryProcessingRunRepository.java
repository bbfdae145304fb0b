package com.eainde.truckticket.repository.memory;

import com.eainde.truckticket.model.ProcessingRun;
import com.eainde.truckticket.repository.ProcessingRunRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryProcessingRunRepository implements ProcessingRunRepository {

    private final ConcurrentMap<String, ProcessingRun> runs = new ConcurrentHashMap<>();

    @Override
    public void insert(ProcessingRun run) {
        if (runs.putIfAbsent(run.requestGuid(), run) != null) {
            throw new IllegalStateException("Processing run " + run.requestGuid() + " already exists");
        }
    }

    @Override
    public void update(ProcessingRun run) {
        runs.compute(run.requestGuid(), (guid, current) -> {
            if (current == null) {
                throw new IllegalStateException("Unknown processing run " + guid);
            }
            if (current.isSealed()) {
                throw new IllegalStateException("Processing run " + guid + " is sealed");
            }
            return run;
        });
    }

    @Override
    public Optional<ProcessingRun> find(String requestGuid) {
        return Optional.ofNullable(runs.get(requestGuid));
    }
}
