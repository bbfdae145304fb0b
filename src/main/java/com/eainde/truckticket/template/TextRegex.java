package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Searches the whole page text with whitespace collapsed, ignoring geometry.
 */
public record TextRegex(Pattern regex) implements ExtractionMethod {

    static final double WEIGHT = 0.80;

    public TextRegex {
        Objects.requireNonNull(regex, "regex");
    }

    @Override
    public String methodName() {
        return "text_regex";
    }

    @Override
    public List<Match> find(OcrPage page) {
        List<Match> matches = ExtractionMethod.newMatchList();
        String text = page.text().replaceAll("\\s+", " ").trim();
        if (text.isEmpty()) {
            return matches;
        }
        double pageConfidence = page.lines().stream().mapToDouble(OcrLine::confidence).average().orElse(1.0);
        ExtractionMethod.collect(regex, text, null, WEIGHT * pageConfidence, matches);
        return matches;
    }
}
