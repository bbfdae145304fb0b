package com.eainde.truckticket.review;

import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.Severity;

import java.util.List;

/**
 * @param severity highest severity among the problems, null for a clean page
 * @param commit   whether the page may be committed as a final ticket
 * @param problems all problems of the page, most severe first
 */
public record RoutingDecision(Severity severity, boolean commit, List<ReviewProblem> problems) {

    public boolean isClean() {
        return problems.isEmpty();
    }
}
