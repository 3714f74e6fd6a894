package com.db.ecd.assessment.exception;

/**
 * A score or rationale was addressed to something that is not one of the seven dimensions.
 * Signals a caller defect rather than a recoverable condition.
 */
public class IllegalDimensionException extends IllegalArgumentException {

    public IllegalDimensionException(String dimension) {
        super("Unknown score dimension: " + dimension);
    }
}
