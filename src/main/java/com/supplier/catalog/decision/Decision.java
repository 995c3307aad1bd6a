package com.supplier.catalog.decision;

import java.util.Objects;

/**
 * @param action      what to write
 * @param needsReview whether the resulting link must be confirmed by a person
 */
public record Decision(ImportAction action, boolean needsReview) {

    public Decision {
        Objects.requireNonNull(action, "action is required");
        if (action != ImportAction.ACCEPT && needsReview) {
            throw new IllegalArgumentException("only ACCEPT decisions can need review");
        }
    }
}
