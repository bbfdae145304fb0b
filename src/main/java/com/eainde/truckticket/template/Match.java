package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.BoundingBox;

/**
 * A regex hit produced by an {@link ExtractionMethod}.
 *
 * @param value      captured text (group 1 when the pattern has one, else the whole match)
 * @param confidence method weight times the OCR confidence of the source line
 * @param box        where the hit was read, null for whole-page text search
 * @param order      position in reading order among the hits of one method
 */
public record Match(String value, double confidence, BoundingBox box, int order) {
}
