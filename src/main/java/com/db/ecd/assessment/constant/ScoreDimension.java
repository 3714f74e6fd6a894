package com.db.ecd.assessment.constant;

import com.db.ecd.assessment.exception.IllegalDimensionException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The seven criteria every assessment must score.
 */
public enum ScoreDimension {
    BUSINESS_GROWTH("businessGrowth", "Business Growth", ScoreAxis.VALUE),
    COST_EFFICIENCY("costEfficiency", "Cost Efficiency", ScoreAxis.VALUE),
    BUSINESS_RESILIENCE("businessResilience", "Business Resilience", ScoreAxis.VALUE),
    BUSINESS_AGILITY("businessAgility", "Business Agility", ScoreAxis.VALUE),
    TECHNICAL_FEASIBILITY("technicalFeasibility", "Technical Feasibility", ScoreAxis.FEASIBILITY),
    INTERNAL_READINESS("internalReadiness", "Internal Readiness", ScoreAxis.FEASIBILITY),
    EXTERNAL_READINESS("externalReadiness", "External Readiness", ScoreAxis.FEASIBILITY);

    private final String key;
    private final String label;
    private final ScoreAxis axis;

    ScoreDimension(String key, String label, ScoreAxis axis) {
        this.key = key;
        this.label = label;
        this.axis = axis;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public ScoreAxis getAxis() {
        return axis;
    }

    /**
     * Resolves a wire key such as {@code businessGrowth}.
     *
     * @throws IllegalDimensionException if the key names no known dimension
     */
    public static ScoreDimension fromKey(String key) {
        return Arrays.stream(values())
                .filter(dimension -> dimension.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalDimensionException(key));
    }
}
