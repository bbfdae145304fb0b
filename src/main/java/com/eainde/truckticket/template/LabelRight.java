package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds a label on a line and matches the text to its right: first the rest of the same
 * line, then the nearest line starting to the right at the same height.
 */
public record LabelRight(List<String> labels, Pattern regex) implements ExtractionMethod {

    static final double WEIGHT = 0.90;

    public LabelRight {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("label_right needs at least one label");
        }
        labels = List.copyOf(labels);
    }

    @Override
    public String methodName() {
        return "label_right";
    }

    @Override
    public List<Match> find(OcrPage page) {
        List<Match> matches = ExtractionMethod.newMatchList();
        List<OcrLine> lines = page.linesInReadingOrder();
        int[] end = new int[1];
        for (OcrLine line : lines) {
            if (ExtractionMethod.indexOfLabel(line.text(), labels, end) < 0) {
                continue;
            }
            String rest = line.text().substring(end[0]).replaceFirst("^[\\s:#.]+", "");
            int before = matches.size();
            ExtractionMethod.collect(regex, rest, line, WEIGHT, matches);
            if (matches.size() == before) {
                neighbourToTheRight(line, lines)
                        .ifPresent(n -> ExtractionMethod.collect(regex, n.text(), n, WEIGHT, matches));
            }
        }
        return matches;
    }

    private static Optional<OcrLine> neighbourToTheRight(OcrLine label, List<OcrLine> lines) {
        double cy = (label.box().y0() + label.box().y1()) / 2;
        return lines.stream()
                .filter(l -> l != label)
                .filter(l -> l.box().x0() >= label.box().x1() - 1e-6)
                .filter(l -> cy >= l.box().y0() && cy <= l.box().y1())
                .min(Comparator.comparingDouble(l -> l.box().x0()));
    }
}
