package com.db.ecd.assessment.exception;

/**
 * Base exception for failures reported by the idea store.
 */
public class IdeaStoreException extends RuntimeException {

    public IdeaStoreException(String message) {
        super(message);
    }

    public IdeaStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
