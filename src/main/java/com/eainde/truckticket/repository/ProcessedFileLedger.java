package com.eainde.truckticket.repository;

import com.eainde.truckticket.model.ProcessedFile;

import java.util.Optional;

/**
 * Whole-file SHA-256 ledger used to short-circuit reprocessing of unchanged files.
 */
public interface ProcessedFileLedger {

    Optional<ProcessedFile> find(String fileHash);

    /**
     * Records a processed file unless its hash is already known.
     *
     * @return false when the hash was already recorded
     */
    boolean recordIfAbsent(ProcessedFile file);
}
