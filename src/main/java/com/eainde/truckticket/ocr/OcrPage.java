package com.eainde.truckticket.ocr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * OCR result of one physical page.
 *
 * @param pageNumber         1-based physical page number within its file
 * @param text               full page text as returned by the engine
 * @param lines              recognized lines with normalized geometry
 * @param orientationDegrees clockwise rotation the engine detected on the scan (0, 90, 180, 270)
 * @param image              grayscale rendering of the page, null when not rasterized
 */
public record OcrPage(int pageNumber, String text, List<OcrLine> lines, int orientationDegrees, PageImage image) {

    public OcrPage {
        if (orientationDegrees % 90 != 0) {
            throw new IllegalArgumentException("orientation must be a multiple of 90, was " + orientationDegrees);
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
        if (text == null) {
            text = lines.stream().sorted(OcrLine.READING_ORDER).map(OcrLine::text).collect(Collectors.joining("\n"));
        }
    }

    public static OcrPage of(int pageNumber, List<OcrLine> lines) {
        return new OcrPage(pageNumber, null, lines, 0, null);
    }

    public static OcrPage textOnly(int pageNumber, String text) {
        return new OcrPage(pageNumber, Objects.requireNonNull(text), List.of(), 0, null);
    }

    public List<OcrLine> linesInReadingOrder() {
        return lines.stream().sorted(OcrLine.READING_ORDER).toList();
    }

    /**
     * Returns this page with all line geometry rotated back to upright coordinates.
     */
    public OcrPage upright() {
        if (orientationDegrees == 0) {
            return this;
        }
        return new OcrPage(pageNumber, text,
                lines.stream().map(l -> l.toUpright(orientationDegrees)).toList(), 0, image);
    }
}
