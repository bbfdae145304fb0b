package com.eainde.truckticket.template;

import com.eainde.truckticket.ocr.OcrLine;
import com.eainde.truckticket.ocr.OcrPage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One way of locating a field value on a page. The set of methods is closed: templates can
 * only name the variants permitted here, and each variant is validated when templates load.
 */
public sealed interface ExtractionMethod permits RoiRegex, LabelRight, TextRegex, BelowLabel {

    /** Name used in template files, e.g. {@code roi_regex}. */
    String methodName();

    Pattern regex();

    /**
     * All regex hits on the page, in reading order. Never null, never throws for missing text.
     */
    List<Match> find(OcrPage page);

    // =========================================================================
    //  Shared helpers
    // =========================================================================

    static String captured(Matcher m) {
        if (m.groupCount() >= 1 && m.group(1) != null) {
            return m.group(1).trim();
        }
        return m.group().trim();
    }

    /**
     * Index of the first label found in {@code text} (case-insensitive), or -1.
     * Returns the end offset of the label through {@code endOut[0]}.
     */
    static int indexOfLabel(String text, List<String> labels, int[] endOut) {
        String upper = text.toUpperCase(Locale.ROOT);
        int best = -1;
        for (String label : labels) {
            int idx = upper.indexOf(label.toUpperCase(Locale.ROOT));
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
                endOut[0] = idx + label.length();
            }
        }
        return best;
    }

    static String stripLabels(String text, List<String> labels) {
        String result = text;
        for (String label : labels) {
            result = result.replaceAll("(?i)" + Pattern.quote(label), " ");
        }
        return result;
    }

    static void collect(Pattern regex, String text, OcrLine source, double weight, List<Match> out) {
        Matcher m = regex.matcher(text);
        while (m.find()) {
            String value = captured(m);
            if (!value.isEmpty()) {
                out.add(new Match(value, weight * (source == null ? 1.0 : source.confidence()),
                        source == null ? null : source.box(), out.size()));
            }
        }
    }

    static List<Match> newMatchList() {
        return new ArrayList<>();
    }
}
