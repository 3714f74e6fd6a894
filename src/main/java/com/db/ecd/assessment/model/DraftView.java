package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.entity.Idea;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What the review panel renders: the open idea, the scorecard so far and, once complete,
 * the Value/Feasibility preview.
 */
@Value
@Builder
public class DraftView {
    Idea selectedIdea;
    Map<String, ScoreLevel> scores;
    Map<String, String> rationales;
    boolean complete;
    List<String> missingDimensions;
    Double valueScore;
    Double feasibilityScore;
    boolean submitting;

    public static DraftView of(ReviewSession session, AxisScores preview) {
        AssessmentDraft draft = session.getDraft();
        return DraftView.builder()
                .selectedIdea(draft.getSelectedIdea())
                .scores(byKey(draft.getScores()))
                .rationales(byKey(draft.getRationales()))
                .complete(draft.isComplete())
                .missingDimensions(draft.missingDimensions().stream()
                        .map(ScoreDimension::getKey)
                        .collect(Collectors.toList()))
                .valueScore(preview != null ? preview.getValue() : null)
                .feasibilityScore(preview != null ? preview.getFeasibility() : null)
                .submitting(session.isBusy())
                .build();
    }

    private static <V> Map<String, V> byKey(Map<ScoreDimension, V> source) {
        Map<String, V> result = new LinkedHashMap<>();
        source.forEach((dimension, value) -> result.put(dimension.getKey(), value));
        return result;
    }
}
