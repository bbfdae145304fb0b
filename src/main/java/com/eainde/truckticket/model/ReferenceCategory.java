package com.eainde.truckticket.model;

/**
 * Reference tables resolved by canonical name.
 */
public enum ReferenceCategory {
    JOB,
    MATERIAL,
    SOURCE,
    DESTINATION,
    VENDOR,
    TICKET_TYPE
}
