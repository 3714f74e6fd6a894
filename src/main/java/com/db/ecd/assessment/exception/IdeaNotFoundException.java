package com.db.ecd.assessment.exception;

public class IdeaNotFoundException extends IdeaStoreException {

    public IdeaNotFoundException(Long ideaId) {
        super("Idea not found: " + ideaId);
    }
}
