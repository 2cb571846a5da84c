package de.bsommerfeld.storygraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Integrity snapshot of every branch in a story.
 *
 * @param story     the inspected story
 * @param healthy   all branches valid and at most one root
 * @param rootCount number of parentless snippets; more than one is legacy
 *                  data that root resolution papers over
 * @param branches  validation per branch name, most recent branch first
 */
public record BranchHealthReport(String story, boolean healthy, int rootCount,
        Map<String, BranchValidation> branches) {

    public BranchHealthReport {
        branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
    }
}
