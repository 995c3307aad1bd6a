package com.supplier.catalog.decision;

import com.supplier.catalog.matching.MatchResult;

/**
 * Turns a match result into an import action. Pure and stateless.
 *
 * <ul>
 *   <li>match with confidence &ge; minimum: ACCEPT</li>
 *   <li>match below the minimum: ACCEPT, flagged for review</li>
 *   <li>no match, creation allowed: CREATE_NEW</li>
 *   <li>no match, creation disabled: REJECT</li>
 * </ul>
 */
public final class DecisionPolicy {

    private DecisionPolicy() {
    }

    public static Decision decide(MatchResult match, double minAutoMatchConfidence, boolean createNewProducts) {
        if (match.hasMatch()) {
            boolean needsReview = match.confidence() < minAutoMatchConfidence;
            return new Decision(ImportAction.ACCEPT, needsReview);
        }
        return createNewProducts
                ? new Decision(ImportAction.CREATE_NEW, false)
                : new Decision(ImportAction.REJECT, false);
    }
}
