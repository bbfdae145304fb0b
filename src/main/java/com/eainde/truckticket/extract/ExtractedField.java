package com.eainde.truckticket.extract;

/**
 * Raw value read for one field. A field that could not be found is an ordinary value
 * with a null {@code value} and confidence 0.
 *
 * @param method the extraction method that produced the value, null when missing
 */
public record ExtractedField(String field, String value, double confidence, String method) {

    public static ExtractedField missing(String field) {
        return new ExtractedField(field, null, 0.0, null);
    }

    public boolean isPresent() {
        return value != null;
    }
}
