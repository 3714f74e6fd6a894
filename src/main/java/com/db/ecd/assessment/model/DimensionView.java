package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.ScoreAxis;
import com.db.ecd.assessment.constant.ScoreDimension;
import lombok.Value;

@Value
public class DimensionView {
    String key;
    String label;
    ScoreAxis axis;

    public static DimensionView of(ScoreDimension dimension) {
        return new DimensionView(dimension.getKey(), dimension.getLabel(), dimension.getAxis());
    }
}
