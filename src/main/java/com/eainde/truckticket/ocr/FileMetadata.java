package com.eainde.truckticket.ocr;

import java.util.Objects;

/**
 * @param fileId   source path as given to the batch
 * @param fileHash SHA-256 hex of the file content
 */
public record FileMetadata(String fileId, String fileHash) {

    public FileMetadata {
        Objects.requireNonNull(fileId, "fileId");
    }
}
