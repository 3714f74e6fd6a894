package com.db.ecd.assessment.service;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.model.AssessmentRecord;

import java.util.List;

/**
 * Canonical home of ideas and their status. Failures surface as
 * {@link com.db.ecd.assessment.exception.IdeaStoreException} or Spring's
 * {@link org.springframework.dao.DataAccessException}.
 */
public interface IdeaStore {

    List<Idea> queryByStatus(IdeaStatus status);

    /**
     * Moves an idea forward. Re-applying its current status is a no-op.
     */
    Idea updateStatus(Long ideaId, IdeaStatus newStatus);

    /**
     * Persists the record and marks the idea {@link IdeaStatus#ASSESSED} as one unit.
     */
    Assessment submitAssessment(Long ideaId, AssessmentRecord record);
}
