package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.exception.IllegalDimensionException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Unsaved scores and rationales for the idea a reviewer currently has open.
 * Selecting another idea discards whatever was entered for the previous one.
 * Access is synchronized since requests of one session may overlap.
 */
public class AssessmentDraft {

    private Idea selectedIdea;
    private final Map<ScoreDimension, ScoreLevel> scores = new EnumMap<>(ScoreDimension.class);
    private final Map<ScoreDimension, String> rationales = new EnumMap<>(ScoreDimension.class);

    public synchronized Idea getSelectedIdea() {
        return selectedIdea;
    }

    public synchronized boolean hasSelection() {
        return selectedIdea != null;
    }

    public synchronized void select(Idea idea) {
        this.selectedIdea = Objects.requireNonNull(idea, "idea");
        reset();
    }

    /**
     * Swaps in a fresher copy of the selected idea without touching scores or rationales.
     * Ignored when the draft no longer holds that idea.
     */
    public synchronized void replaceSelectedIdea(Idea idea) {
        if (selectedIdea != null && Objects.equals(selectedIdea.getId(), idea.getId())) {
            this.selectedIdea = idea;
        }
    }

    public synchronized void clearSelection() {
        this.selectedIdea = null;
        reset();
    }

    public synchronized void setScore(ScoreDimension dimension, ScoreLevel level) {
        requireDimension(dimension);
        scores.put(dimension, Objects.requireNonNull(level, "level"));
    }

    public synchronized void setRationale(ScoreDimension dimension, String text) {
        requireDimension(dimension);
        rationales.put(dimension, text == null ? "" : text);
    }

    /**
     * True once every dimension has a score. Rationales are never required.
     */
    public synchronized boolean isComplete() {
        return scores.size() == ScoreDimension.values().length;
    }

    public synchronized List<ScoreDimension> missingDimensions() {
        return Arrays.stream(ScoreDimension.values())
                .filter(dimension -> !scores.containsKey(dimension))
                .collect(Collectors.toList());
    }

    public synchronized void reset() {
        scores.clear();
        rationales.clear();
    }

    public synchronized Map<ScoreDimension, ScoreLevel> getScores() {
        return Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    public synchronized Map<ScoreDimension, String> getRationales() {
        return Collections.unmodifiableMap(new EnumMap<>(rationales));
    }

    private static void requireDimension(ScoreDimension dimension) {
        if (dimension == null) {
            throw new IllegalDimensionException("null");
        }
    }
}
