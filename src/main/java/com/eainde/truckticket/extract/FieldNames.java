package com.eainde.truckticket.extract;

import java.util.List;

/**
 * Field names used as keys in vendor templates and in review entries.
 */
public final class FieldNames {

    public static final String TICKET_NUMBER   = "ticket_number";
    public static final String TICKET_DATE     = "date";
    public static final String QUANTITY        = "quantity";
    public static final String MANIFEST_NUMBER = "manifest_number";
    public static final String TRUCK_NUMBER    = "truck_number";
    public static final String MATERIAL        = "material";
    public static final String SOURCE          = "source";
    public static final String DESTINATION     = "destination";

    // Not extracted from the page, but reported alongside extracted fields
    public static final String VENDOR          = "vendor";
    public static final String JOB             = "job";
    public static final String TICKET_TYPE     = "ticket_type";

    /** Fields read from every page, in extraction order. */
    public static final List<String> EXTRACTED = List.of(
            TICKET_NUMBER, TICKET_DATE, QUANTITY, MANIFEST_NUMBER,
            TRUCK_NUMBER, MATERIAL, SOURCE, DESTINATION);

    private FieldNames() {}
}
