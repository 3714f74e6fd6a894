package com.db.ecd.assessment.constant;

/**
 * Failure kinds reported by the assessment workflow.
 */
public enum WorkflowError {
    /** Submission refused locally: no idea selected, unscored dimensions or missing attribution. */
    VALIDATION,
    /** The idea store rejected or failed a write. The draft is kept so the action can be retried. */
    SUBMISSION,
    /** A select or submit for the same session is still outstanding. */
    IN_PROGRESS
}
