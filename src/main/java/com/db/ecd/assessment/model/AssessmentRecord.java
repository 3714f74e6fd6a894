package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Map;

/**
 * The finished assessment handed to the idea store. Holds copies, so later draft edits never leak in.
 */
@Value
@Builder
public class AssessmentRecord {
    Map<ScoreDimension, ScoreLevel> scores;
    Map<ScoreDimension, String> rationales;
    String assessedBy;

    public boolean isComplete() {
        return scores != null && scores.keySet().containsAll(EnumSet.allOf(ScoreDimension.class));
    }

    public static AssessmentRecord fromDraft(AssessmentDraft draft, String assessedBy) {
        if (!draft.isComplete()) {
            throw new IllegalStateException("Draft is missing scores for " + draft.missingDimensions());
        }
        return AssessmentRecord.builder()
                .scores(draft.getScores())
                .rationales(draft.getRationales())
                .assessedBy(assessedBy)
                .build();
    }
}
