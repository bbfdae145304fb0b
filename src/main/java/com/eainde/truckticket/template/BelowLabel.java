package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.BoundingBox;
import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fallback that reads the row of text directly beneath an anchor: the primary method's
 * region when it has one, otherwise the first line carrying one of the labels.
 */
public record BelowLabel(BoundingBox anchor, List<String> labels, Pattern regex) implements ExtractionMethod {

    static final double WEIGHT = 0.75;

    public BelowLabel {
        Objects.requireNonNull(regex, "regex");
        labels = labels == null ? List.of() : List.copyOf(labels);
        if (anchor == null && labels.isEmpty()) {
            throw new IllegalArgumentException("below_label needs a region or a label to anchor on");
        }
    }

    @Override
    public String methodName() {
        return "below_label";
    }

    @Override
    public List<Match> find(OcrPage page) {
        List<Match> matches = ExtractionMethod.newMatchList();
        List<OcrLine> lines = page.linesInReadingOrder();
        Optional<BoundingBox> anchorBox = anchor != null ? Optional.of(anchor) : labelLine(lines);
        if (anchorBox.isEmpty()) {
            return matches;
        }
        BoundingBox a = anchorBox.get();
        List<OcrLine> below = lines.stream()
                .filter(l -> l.box().y0() >= a.y1() - 1e-6)
                .filter(l -> l.box().overlapsHorizontally(a))
                .toList();
        if (below.isEmpty()) {
            return matches;
        }
        OcrLine nearest = below.stream().min(Comparator.comparingDouble(l -> l.box().y0())).orElseThrow();
        for (OcrLine line : below) {
            if (line.box().y0() <= nearest.box().y1()) {
                ExtractionMethod.collect(regex, ExtractionMethod.stripLabels(line.text(), labels), line, WEIGHT, matches);
            }
        }
        return matches;
    }

    private Optional<BoundingBox> labelLine(List<OcrLine> lines) {
        int[] end = new int[1];
        return lines.stream()
                .filter(l -> ExtractionMethod.indexOfLabel(l.text(), labels, end) >= 0)
                .findFirst()
                .map(OcrLine::box);
    }
}
