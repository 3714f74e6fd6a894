package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.constant.ScoreDimension;
import com.db.ecd.assessment.constant.ScoreLevel;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.exception.IllegalDimensionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AssessmentDraft")
class AssessmentDraftTest {

    private AssessmentDraft draft;

    @BeforeEach
    void setUp() {
        draft = new AssessmentDraft();
    }

    @Test
    @DisplayName("Should start empty and incomplete")
    void shouldStartEmpty() {
        assertThat(draft.hasSelection()).isFalse();
        assertThat(draft.getScores()).isEmpty();
        assertThat(draft.getRationales()).isEmpty();
        assertThat(draft.isComplete()).isFalse();
        assertThat(draft.missingDimensions()).containsExactly(ScoreDimension.values());
    }

    @Test
    @DisplayName("Should be complete once all seven dimensions are scored, rationales optional")
    void shouldCompleteWithoutRationales() {
        for (ScoreDimension dimension : ScoreDimension.values()) {
            assertThat(draft.isComplete()).isFalse();
            draft.setScore(dimension, ScoreLevel.MEDIUM);
        }

        assertThat(draft.isComplete()).isTrue();
        assertThat(draft.missingDimensions()).isEmpty();
        assertThat(draft.getRationales()).isEmpty();
    }

    @Test
    @DisplayName("Should overwrite a score instead of adding a second one")
    void shouldOverwriteScore() {
        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.LOW);
        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.HIGH);

        assertThat(draft.getScores()).containsOnlyKeys(ScoreDimension.BUSINESS_GROWTH);
        assertThat(draft.getScores().get(ScoreDimension.BUSINESS_GROWTH)).isEqualTo(ScoreLevel.HIGH);
    }

    @Test
    @DisplayName("Completeness tracks the set of scored dimensions for any call sequence")
    void completenessMatchesScoredSet() {
        Random random = new Random(42);
        ScoreDimension[] dimensions = ScoreDimension.values();
        ScoreLevel[] levels = ScoreLevel.values();

        for (int run = 0; run < 200; run++) {
            draft.reset();
            Set<ScoreDimension> seen = EnumSet.noneOf(ScoreDimension.class);
            int calls = random.nextInt(20);
            for (int i = 0; i < calls; i++) {
                ScoreDimension dimension = dimensions[random.nextInt(dimensions.length)];
                draft.setScore(dimension, levels[random.nextInt(levels.length)]);
                seen.add(dimension);
                assertThat(draft.isComplete()).isEqualTo(seen.size() == dimensions.length);
            }
        }
    }

    @Test
    @DisplayName("Should accept empty and null rationales")
    void shouldAcceptEmptyRationale() {
        draft.setRationale(ScoreDimension.COST_EFFICIENCY, "");
        draft.setRationale(ScoreDimension.BUSINESS_AGILITY, null);

        assertThat(draft.getRationales())
                .containsEntry(ScoreDimension.COST_EFFICIENCY, "")
                .containsEntry(ScoreDimension.BUSINESS_AGILITY, "");
    }

    @Test
    @DisplayName("Should reject a missing dimension")
    void shouldRejectNullDimension() {
        assertThatThrownBy(() -> draft.setScore(null, ScoreLevel.HIGH))
                .isInstanceOf(IllegalDimensionException.class);
        assertThatThrownBy(() -> draft.setRationale(null, "text"))
                .isInstanceOf(IllegalDimensionException.class);
        assertThat(draft.getScores()).isEmpty();
    }

    @Test
    @DisplayName("Selecting an idea discards the previous draft")
    void selectingResetsDraft() {
        draft.select(idea(1L));
        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.HIGH);
        draft.setRationale(ScoreDimension.BUSINESS_GROWTH, "Opens a new market");

        draft.select(idea(2L));

        assertThat(draft.getSelectedIdea().getId()).isEqualTo(2L);
        assertThat(draft.getScores()).isEmpty();
        assertThat(draft.getRationales()).isEmpty();
    }

    @Test
    @DisplayName("Replacing the selected idea keeps scores and rationales")
    void replacingSelectedIdeaKeepsDraft() {
        draft.select(idea(1L));
        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.HIGH);
        draft.setRationale(ScoreDimension.BUSINESS_GROWTH, "Opens a new market");
        Idea fresher = idea(1L);
        fresher.setStatus(IdeaStatus.ASSESSED);

        draft.replaceSelectedIdea(fresher);

        assertThat(draft.getSelectedIdea()).isSameAs(fresher);
        assertThat(draft.getScores()).containsEntry(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.HIGH);
        assertThat(draft.getRationales()).containsEntry(ScoreDimension.BUSINESS_GROWTH, "Opens a new market");
    }

    @Test
    @DisplayName("Replacing is ignored once the draft holds another idea or none")
    void replacingIgnoredForOtherIdea() {
        Idea current = idea(2L);
        draft.select(current);

        draft.replaceSelectedIdea(idea(1L));
        assertThat(draft.getSelectedIdea()).isSameAs(current);

        draft.clearSelection();
        draft.replaceSelectedIdea(idea(2L));
        assertThat(draft.hasSelection()).isFalse();
    }

    @Test
    @DisplayName("Clearing the selection empties everything")
    void clearSelectionEmptiesDraft() {
        draft.select(idea(1L));
        draft.setScore(ScoreDimension.INTERNAL_READINESS, ScoreLevel.LOW);

        draft.clearSelection();

        assertThat(draft.hasSelection()).isFalse();
        assertThat(draft.getScores()).isEmpty();
    }

    @Test
    @DisplayName("Snapshots do not change when the draft does")
    void snapshotsAreDetached() {
        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.HIGH);
        Map<ScoreDimension, ScoreLevel> snapshot = draft.getScores();

        draft.setScore(ScoreDimension.BUSINESS_GROWTH, ScoreLevel.LOW);

        assertThat(snapshot.get(ScoreDimension.BUSINESS_GROWTH)).isEqualTo(ScoreLevel.HIGH);
        assertThatThrownBy(() -> snapshot.put(ScoreDimension.COST_EFFICIENCY, ScoreLevel.LOW))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static Idea idea(Long id) {
        Idea idea = new Idea();
        idea.setId(id);
        idea.setTitle("Idea " + id);
        idea.setSubmitterName("tester");
        idea.setStatus(IdeaStatus.UNDER_REVIEW);
        return idea;
    }
}
