package com.db.ecd.assessment.service;

import com.db.ecd.assessment.constant.ScoreAxis;
import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.model.AxisScores;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Value/Feasibility aggregation. Each axis score is the mean of its dimensions' level points,
 * so it ranges from 1.0 (all LOW) to 3.0 (all HIGH).
 */
@Component
public class ScoringModel {

    private final Map<ScoreAxis, List<ScoreDimension>> dimensionsByAxis = new EnumMap<>(ScoreAxis.class);

    public ScoringModel() {
        for (ScoreAxis axis : ScoreAxis.values()) {
            dimensionsByAxis.put(axis, Arrays.stream(ScoreDimension.values())
                    .filter(dimension -> dimension.getAxis() == axis)
                    .collect(Collectors.toUnmodifiableList()));
        }
    }

    public List<ScoreDimension> dimensions() {
        return List.of(ScoreDimension.values());
    }

    public List<ScoreDimension> dimensionsFor(ScoreAxis axis) {
        return dimensionsByAxis.get(axis);
    }

    /**
     * @throws IllegalArgumentException if any dimension of the axis is unscored
     */
    public double aggregate(ScoreAxis axis, Map<ScoreDimension, ScoreLevel> scores) {
        List<ScoreDimension> dimensions = dimensionsFor(axis);
        int total = 0;
        for (ScoreDimension dimension : dimensions) {
            ScoreLevel level = scores.get(dimension);
            if (level == null) {
                throw new IllegalArgumentException("Missing score for " + dimension.getKey());
            }
            total += level.getPoints();
        }
        return (double) total / dimensions.size();
    }

    public AxisScores score(Map<ScoreDimension, ScoreLevel> scores) {
        return new AxisScores(
                aggregate(ScoreAxis.VALUE, scores),
                aggregate(ScoreAxis.FEASIBILITY, scores));
    }
}
