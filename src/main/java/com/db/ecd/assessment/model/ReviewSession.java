package com.db.ecd.assessment.model;

import com.db.ecd.assessment.entity.Idea;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State owned by one reviewer: the draft, the last pending list fetched for them, and
 * whether a select or submit is still talking to the store.
 */
public class ReviewSession {

    private final AssessmentDraft draft = new AssessmentDraft();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile List<Idea> pendingIdeas = List.of();

    public AssessmentDraft getDraft() {
        return draft;
    }

    public List<Idea> getPendingIdeas() {
        return pendingIdeas;
    }

    public void setPendingIdeas(List<Idea> pendingIdeas) {
        this.pendingIdeas = List.copyOf(pendingIdeas);
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    /**
     * Claims the session for one store call. Returns false if another call holds it.
     */
    public boolean tryBegin() {
        return inFlight.compareAndSet(false, true);
    }

    public void end() {
        inFlight.set(false);
    }
}
