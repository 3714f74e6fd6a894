package com.db.ecd.assessment.constant;

import com.db.ecd.assessment.exception.IllegalDimensionException;
import com.db.ecd.assessment.exception.InvalidScoreLevelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Score dimension and level parsing")
class ScoreDimensionTest {

    @Test
    @DisplayName("Should resolve every wire key")
    void shouldResolveWireKeys() {
        for (ScoreDimension dimension : ScoreDimension.values()) {
            assertThat(ScoreDimension.fromKey(dimension.getKey())).isEqualTo(dimension);
        }
        assertThat(ScoreDimension.fromKey("businessGrowth")).isEqualTo(ScoreDimension.BUSINESS_GROWTH);
        assertThat(ScoreDimension.fromKey("externalReadiness").getAxis()).isEqualTo(ScoreAxis.FEASIBILITY);
    }

    @Test
    @DisplayName("Should reject keys outside the seven dimensions")
    void shouldRejectUnknownKey() {
        assertThatThrownBy(() -> ScoreDimension.fromKey("marketSize"))
                .isInstanceOf(IllegalDimensionException.class)
                .hasMessageContaining("marketSize");
        assertThatThrownBy(() -> ScoreDimension.fromKey(null))
                .isInstanceOf(IllegalDimensionException.class);
    }

    @Test
    @DisplayName("Should parse levels regardless of case")
    void shouldParseLevels() {
        assertThat(ScoreLevel.fromName("High")).isEqualTo(ScoreLevel.HIGH);
        assertThat(ScoreLevel.fromName(" medium ")).isEqualTo(ScoreLevel.MEDIUM);
        assertThat(ScoreLevel.fromName("LOW")).isEqualTo(ScoreLevel.LOW);
        assertThat(ScoreLevel.LOW.getPoints()).isLessThan(ScoreLevel.MEDIUM.getPoints());
        assertThat(ScoreLevel.MEDIUM.getPoints()).isLessThan(ScoreLevel.HIGH.getPoints());
    }

    @Test
    @DisplayName("Should reject unknown levels")
    void shouldRejectUnknownLevel() {
        assertThatThrownBy(() -> ScoreLevel.fromName("Extreme"))
                .isInstanceOf(InvalidScoreLevelException.class);
        assertThatThrownBy(() -> ScoreLevel.fromName(null))
                .isInstanceOf(InvalidScoreLevelException.class);
    }
}
