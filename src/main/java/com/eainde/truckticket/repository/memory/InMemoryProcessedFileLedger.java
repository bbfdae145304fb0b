package com.eainde.truckticket.repository.memory;

import com.eainde.truckticket.model.ProcessedFile;
import com.eainde.truckticket.repository.ProcessedFileLedger;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryProcessedFileLedger implements ProcessedFileLedger {

    private final ConcurrentMap<String, ProcessedFile> files = new ConcurrentHashMap<>();

    @Override
    public Optional<ProcessedFile> find(String fileHash) {
        return Optional.ofNullable(files.get(fileHash));
    }

    @Override
    public boolean recordIfAbsent(ProcessedFile file) {
        return files.putIfAbsent(file.fileHash(), file) == null;
    }
}
