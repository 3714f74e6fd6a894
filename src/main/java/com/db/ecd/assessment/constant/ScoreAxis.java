package com.db.ecd.assessment.constant;

public enum ScoreAxis {
    VALUE,
    FEASIBILITY
}
