package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.BoundingBox;
import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;
import com.eainde.truckticket.ocr.OcrWord;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Searches only the text whose geometry falls inside a normalized region. Label text
 * found inside the region is blanked before matching so that label digits are never
 * taken for the value.
 */
public record RoiRegex(BoundingBox roi, List<String> labels, Pattern regex) implements ExtractionMethod {

    static final double WEIGHT = 0.95;

    public RoiRegex {
        Objects.requireNonNull(roi, "roi");
        Objects.requireNonNull(regex, "regex");
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override
    public String methodName() {
        return "roi_regex";
    }

    @Override
    public List<Match> find(OcrPage page) {
        List<Match> matches = ExtractionMethod.newMatchList();
        for (OcrLine line : page.linesInReadingOrder()) {
            String inside = textInside(line);
            if (inside == null) {
                continue;
            }
            ExtractionMethod.collect(regex, ExtractionMethod.stripLabels(inside, labels), line, WEIGHT, matches);
        }
        return matches;
    }

    /**
     * Text of the words whose centre lies in the region; for lines reported without words,
     * the whole line if its centre lies in the region.
     */
    private String textInside(OcrLine line) {
        if (!line.words().isEmpty()) {
            String joined = line.words().stream()
                    .filter(w -> centreInside(w.box()))
                    .map(OcrWord::value)
                    .collect(Collectors.joining(" "));
            return joined.isEmpty() ? null : joined;
        }
        return centreInside(line.box()) ? line.text() : null;
    }

    private boolean centreInside(BoundingBox b) {
        double cx = (b.x0() + b.x1()) / 2;
        double cy = (b.y0() + b.y1()) / 2;
        return cx >= roi.x0() && cx <= roi.x1() && cy >= roi.y0() && cy <= roi.y1();
    }
}
