package com.db.ecd.assessment.exception;

import com.db.ecd.assessment.constant.IdeaStatus;

/**
 * Thrown when a write would move an idea backwards or out of a terminal status.
 */
public class InvalidStatusTransitionException extends IdeaStoreException {

    public InvalidStatusTransitionException(Long ideaId, IdeaStatus from, IdeaStatus to) {
        super("Idea " + ideaId + " cannot move from " + from + " to " + to);
    }

    public InvalidStatusTransitionException(String message) {
        super(message);
    }
}
