package com.eainde.truckticket.model;

import java.util.Objects;

/**
 * File + physical page composite identifying one scanned ticket page.
 */
public record PageId(String fileId, int pageNumber) implements Comparable<PageId> {

    public PageId {
        Objects.requireNonNull(fileId, "fileId");
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1, was " + pageNumber);
        }
    }

    @Override
    public int compareTo(PageId o) {
        int c = fileId.compareTo(o.fileId);
        return c != 0 ? c : Integer.compare(pageNumber, o.pageNumber);
    }

    @Override
    public String toString() {
        return fileId + "#" + pageNumber;
    }
}
