package com.db.ecd.assessment.constant;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: SUBMITTED → UNDER_REVIEW → ASSESSED, with REJECTED reachable from either pending state.
 */
public enum IdeaStatus {
    SUBMITTED,
    UNDER_REVIEW,
    ASSESSED,
    REJECTED;

    public boolean isPending() {
        return this == SUBMITTED || this == UNDER_REVIEW;
    }

    public boolean isTerminal() {
        return this == ASSESSED || this == REJECTED;
    }

    public boolean canTransitionTo(IdeaStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<IdeaStatus> allowedTargets() {
        switch (this) {
            case SUBMITTED:
                return EnumSet.of(UNDER_REVIEW, ASSESSED, REJECTED);
            case UNDER_REVIEW:
                return EnumSet.of(ASSESSED, REJECTED);
            default:
                return EnumSet.noneOf(IdeaStatus.class);
        }
    }
}
