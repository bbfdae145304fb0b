package com.eainde.truckticket.exception;

import java.util.List;

/**
 * Raised while loading vendor templates. Collects every problem found in the
 * template source rather than stopping at the first one.
 */
public class TemplateValidationException extends TicketPipelineException {

    private final List<String> errors;

    public TemplateValidationException(String source, List<String> errors) {
        super("Invalid vendor templates in " + source + ":\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public TemplateValidationException(String source, Throwable cause) {
        super("Unable to read vendor templates from " + source, cause);
        this.errors = List.of(cause.getMessage() == null ? cause.toString() : cause.getMessage());
    }

    public List<String> getErrors() {
        return errors;
    }
}
