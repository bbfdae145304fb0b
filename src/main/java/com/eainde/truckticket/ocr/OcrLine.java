package com.eainde.truckticket.ocr;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A recognized text line with its words.
 */
public record OcrLine(String text, List<OcrWord> words, BoundingBox box) {

    /** Top-to-bottom, then left-to-right. */
    public static final Comparator<OcrLine> READING_ORDER =
            Comparator.comparingDouble((OcrLine l) -> l.box().y0()).thenComparingDouble(l -> l.box().x0());

    public OcrLine {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(box, "box");
        words = words == null ? List.of() : List.copyOf(words);
    }

    /**
     * Builds a line without word geometry, as some engines only report lines.
     */
    public static OcrLine of(String text, BoundingBox box) {
        return new OcrLine(text, List.of(), box);
    }

    /**
     * Mean word confidence, or 1.0 when the engine reported no words.
     */
    public double confidence() {
        return words.stream().mapToDouble(OcrWord::confidence).average().orElse(1.0);
    }

    public OcrLine toUpright(int orientationDegrees) {
        return new OcrLine(text,
                words.stream().map(w -> w.toUpright(orientationDegrees)).toList(),
                box.toUpright(orientationDegrees));
    }
}
