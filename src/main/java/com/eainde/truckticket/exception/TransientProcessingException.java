package com.eainde.truckticket.exception;

/**
 * An infrastructure failure worth retrying: OCR call errors, file I/O, persistence timeouts.
 */
public class TransientProcessingException extends TicketPipelineException {

    public TransientProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
