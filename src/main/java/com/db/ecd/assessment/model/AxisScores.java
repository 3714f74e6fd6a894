package com.db.ecd.assessment.model;

import lombok.Value;

@Value
public class AxisScores {
    double value;
    double feasibility;
}
