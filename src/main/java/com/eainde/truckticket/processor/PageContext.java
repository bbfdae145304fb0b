package com.eainde.truckticket.processor;

import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewReason;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one page while it is processed. Owned by a single worker thread and
 * discarded once the page reaches a terminal state.
 */
public final class PageContext {

    private final PageId pageId;
    private final int orientationDegrees;
    private final List<ReviewProblem> problems = new ArrayList<>();
    private final Map<String, String> detectedFields = new LinkedHashMap<>();
    private PageState state = PageState.EXTRACTING;

    public PageContext(PageId pageId, int orientationDegrees) {
        this.pageId = pageId;
        this.orientationDegrees = orientationDegrees;
    }

    public void advance(PageState next) {
        if (!state.successors().contains(next)) {
            throw new IllegalStateException("Page " + pageId + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    public void problem(ReviewReason reason, String field, String detail) {
        problems.add(ReviewProblem.of(reason, field, detail));
    }

    public void problem(ReviewProblem problem) {
        problems.add(problem);
    }

    public void problems(Collection<ReviewProblem> more) {
        problems.addAll(more);
    }

    public void detected(String field, String rawValue) {
        detectedFields.put(field, rawValue);
    }

    public PageId pageId() {
        return pageId;
    }

    public int orientationDegrees() {
        return orientationDegrees;
    }

    public PageState state() {
        return state;
    }

    public List<ReviewProblem> problems() {
        return Collections.unmodifiableList(problems);
    }

    public Map<String, String> detectedFields() {
        return Collections.unmodifiableMap(detectedFields);
    }
}
