package com.eainde.truckticket.exception;

import com.eainde.truckticket.model.ReferenceCategory;

public class ReferenceNotFoundException extends TicketPipelineException {

    private final ReferenceCategory category;
    private final String value;

    public ReferenceNotFoundException(ReferenceCategory category, String value) {
        super(String.format("No %s reference named '%s'", category, value));
        this.category = category;
        this.value = value;
    }

    public ReferenceCategory getCategory() {
        return category;
    }

    public String getValue() {
        return value;
    }
}
