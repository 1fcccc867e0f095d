package com.purchasingpower.concierge.catalog;

import java.util.List;

/**
 * Product search used by discovery. Implementations should honor
 * {@link CandidateQuery#excludedIngredients()}, but results are still filtered
 * by the safety gates afterwards.
 */
public interface CandidateFetcher {

    List<Candidate> fetch(CandidateQuery query);
}
