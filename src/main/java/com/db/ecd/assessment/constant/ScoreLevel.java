package com.db.ecd.assessment.constant;

import com.db.ecd.assessment.exception.InvalidScoreLevelException;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;

/**
 * Ordered rating shared by every dimension. Points grow with the level.
 */
public enum ScoreLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int points;

    ScoreLevel(int points) {
        this.points = points;
    }

    public int getPoints() {
        return points;
    }

    @JsonCreator
    public static ScoreLevel fromName(String name) {
        if (name == null) {
            throw new InvalidScoreLevelException("Score level is required");
        }
        return Arrays.stream(values())
                .filter(level -> level.name().equalsIgnoreCase(name.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidScoreLevelException("Unknown score level: " + name));
    }
}
