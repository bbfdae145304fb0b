package com.eainde.truckticket.validation;

import com.eainde.truckticket.model.TruckTicket;

/**
 * A previously committed ticket that the candidate duplicates.
 *
 * @param daysApart candidate date minus original date, never negative
 */
public record DuplicateMatch(TruckTicket original, long daysApart) {
}
