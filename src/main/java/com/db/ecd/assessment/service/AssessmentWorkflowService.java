package com.db.ecd.assessment.service;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.constant.WorkflowError;
import com.db.ecd.assessment.entity.Assessment;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.exception.IdeaStoreException;
import com.db.ecd.assessment.model.AssessmentDraft;
import com.db.ecd.assessment.model.AssessmentRecord;
import com.db.ecd.assessment.model.AxisScores;
import com.db.ecd.assessment.model.ReviewSession;
import com.db.ecd.assessment.model.WorkflowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Drives a reviewer session through the queue: pick an idea, score it, submit.
 * <p>
 * Local draft edits always succeed. Only the store calls can fail, and their outcome is the
 * sole trigger for clearing the draft or refreshing the pending list. Select and submit claim
 * the session while they talk to the store, so a second call made meanwhile is refused with
 * {@link WorkflowError#IN_PROGRESS} instead of being dispatched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentWorkflowService {

    private final IdeaStore ideaStore;
    private final ScoringModel scoringModel;

    /**
     * Submitted ideas followed by ideas under review, each in store order.
     */
    public List<Idea> listPending() {
        List<Idea> pending = new ArrayList<>(ideaStore.queryByStatus(IdeaStatus.SUBMITTED));
        pending.addAll(ideaStore.queryByStatus(IdeaStatus.UNDER_REVIEW));
        return pending;
    }

    public WorkflowResult<List<Idea>> refreshPending(ReviewSession session) {
        try {
            List<Idea> pending = listPending();
            session.setPendingIdeas(pending);
            return WorkflowResult.success(session.getPendingIdeas());
        } catch (IdeaStoreException | DataAccessException e) {
            log.error("Failed to load pending ideas", e);
            return WorkflowResult.failure(WorkflowError.SUBMISSION, "Failed to load pending ideas");
        }
    }

    public WorkflowResult<Idea> selectIdea(ReviewSession session, Idea idea) {
        if (idea.getStatus().isTerminal()) {
            return WorkflowResult.failure(WorkflowError.VALIDATION,
                    "\"" + idea.getTitle() + "\" is no longer pending assessment");
        }
        if (!session.tryBegin()) {
            return busy();
        }
        try {
            AssessmentDraft draft = session.getDraft();
            draft.select(idea);

            if (idea.getStatus() != IdeaStatus.SUBMITTED) {
                log.debug("Idea {} already under review, no status update", idea.getId());
                return WorkflowResult.success(idea);
            }

            Idea underReview;
            try {
                underReview = ideaStore.updateStatus(idea.getId(), IdeaStatus.UNDER_REVIEW);
            } catch (IdeaStoreException | DataAccessException e) {
                log.error("Failed to mark idea {} as under review", idea.getId(), e);
                return WorkflowResult.failure(WorkflowError.SUBMISSION, "Failed to start review of \"" + idea.getTitle() + "\"");
            }

            draft.replaceSelectedIdea(underReview);
            log.info("Idea {} is now under review", idea.getId());
            refreshQuietly(session);
            return WorkflowResult.success(underReview);
        } finally {
            session.end();
        }
    }

    public void setScore(ReviewSession session, ScoreDimension dimension, ScoreLevel level) {
        session.getDraft().setScore(dimension, level);
    }

    public void setRationale(ReviewSession session, ScoreDimension dimension, String rationale) {
        session.getDraft().setRationale(dimension, rationale);
    }

    /**
     * Drops the selection and draft. The idea stays under review; nothing is written to the store.
     */
    public void cancelSelection(ReviewSession session) {
        AssessmentDraft draft = session.getDraft();
        if (draft.hasSelection()) {
            log.info("Review of idea {} cancelled, status left as is", draft.getSelectedIdea().getId());
        }
        draft.clearSelection();
    }

    public Optional<AxisScores> previewScores(ReviewSession session) {
        AssessmentDraft draft = session.getDraft();
        return draft.isComplete() ? Optional.of(scoringModel.score(draft.getScores())) : Optional.empty();
    }

    public WorkflowResult<Assessment> submitAssessment(ReviewSession session, String attribution) {
        if (!session.tryBegin()) {
            return busy();
        }
        try {
            if (attribution == null || attribution.isBlank()) {
                return WorkflowResult.failure(WorkflowError.VALIDATION, "An assessor name is required");
            }

            AssessmentDraft draft = session.getDraft();
            Idea idea;
            AssessmentRecord record;
            synchronized (draft) {
                if (!draft.hasSelection()) {
                    return WorkflowResult.failure(WorkflowError.VALIDATION, "Select an idea before submitting an assessment");
                }
                if (!draft.isComplete()) {
                    log.warn("Refused assessment of idea {}: unscored {}", draft.getSelectedIdea().getId(), keys(draft));
                    return WorkflowResult.failure(WorkflowError.VALIDATION, "Please score all dimensions before submitting");
                }
                idea = draft.getSelectedIdea();
                record = AssessmentRecord.fromDraft(draft, attribution.trim());
            }

            Assessment assessment;
            try {
                assessment = ideaStore.submitAssessment(idea.getId(), record);
            } catch (IdeaStoreException | DataAccessException e) {
                log.error("Failed to submit assessment for idea {}", idea.getId(), e);
                return WorkflowResult.failure(WorkflowError.SUBMISSION, "Failed to submit assessment");
            }

            synchronized (draft) {
                if (draft.hasSelection() && Objects.equals(draft.getSelectedIdea().getId(), idea.getId())) {
                    draft.clearSelection();
                }
            }
            refreshQuietly(session);
            return WorkflowResult.success(assessment, "\"" + idea.getTitle() + "\" has been assessed!");
        } finally {
            session.end();
        }
    }

    private void refreshQuietly(ReviewSession session) {
        WorkflowResult<List<Idea>> refreshed = refreshPending(session);
        if (!refreshed.isSuccess()) {
            log.warn("Pending list not refreshed: {}", refreshed.getMessage());
        }
    }

    private static String keys(AssessmentDraft draft) {
        return draft.missingDimensions().stream()
                .map(ScoreDimension::getKey)
                .collect(Collectors.joining(", "));
    }

    private static <T> WorkflowResult<T> busy() {
        return WorkflowResult.failure(WorkflowError.IN_PROGRESS, "Another action is still in progress");
    }
}
