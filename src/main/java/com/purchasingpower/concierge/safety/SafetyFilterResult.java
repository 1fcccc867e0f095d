package com.purchasingpower.concierge.safety;

import com.purchasingpower.concierge.catalog.Candidate;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of both gates. Every input candidate is either a survivor or has
 * exactly one violation.
 *
 * @param survivors Candidates that passed both gates, input order preserved
 * @param violations One entry per removed candidate
 * @param allVetoed True when there were candidates and none survived
 */
public record SafetyFilterResult(List<Candidate> survivors, List<Violation> violations, boolean allVetoed)
        implements Serializable {

    public SafetyFilterResult {
        survivors = List.copyOf(survivors);
        violations = List.copyOf(violations);
    }

    public static SafetyFilterResult passThrough(List<Candidate> candidates) {
        return new SafetyFilterResult(candidates, List.of(), false);
    }
}
