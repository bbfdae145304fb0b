package com.eainde.truckticket.exception;

/**
 * Root of the pipeline's unchecked exceptions.
 */
public class TicketPipelineException extends RuntimeException {

    public TicketPipelineException(String message) {
        super(message);
    }

    public TicketPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
