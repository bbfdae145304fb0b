package com.eainde.truckticket.ocr;

import java.nio.file.Path;
import java.util.List;

/**
 * Rasterizes and recognizes a source document. Supplied by the host application.
 *
 * <p>Implementations must be safe to call from several worker threads; each call covers
 * one whole file so model state can be reused across its pages.</p>
 */
public interface OcrEngine {

    /**
     * @return one entry per physical page, in page order
     * @throws OcrException when recognition fails; the batch processor retries such failures
     * @throws com.eainde.truckticket.exception.TransientProcessingException unchecked variant for
     *         backends that wrap their own client errors; also retried
     */
    List<OcrPage> recognize(Path file) throws OcrException;
}
