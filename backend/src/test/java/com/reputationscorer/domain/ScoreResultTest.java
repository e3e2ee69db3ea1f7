package com.reputationscorer.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreResultTest {

    @Test
    @DisplayName("inactive result has zero score and the inactive tag")
    void inactiveResult() {
        ScoreResult result = ScoreResult.inactive();

        assertThat(result.finalScore()).isZero();
        assertThat(result.isInactive()).isTrue();
        assertThat(result.features().userTags()).containsExactly(ScoreResult.TAG_INACTIVE);
    }

    @Test
    @DisplayName("zero score without the inactive tag is rejected")
    void zeroScoreRequiresInactiveTag() {
        ScoreFeatures features = new ScoreFeatures(0.0, 0.0, 1, 1, List.of());

        assertThatThrownBy(() -> new ScoreResult(0.0, features))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ScoreResult.TAG_INACTIVE);
    }

    @Test
    @DisplayName("positive score carrying the inactive tag is rejected")
    void positiveScoreMustNotBeInactive() {
        ScoreFeatures features = new ScoreFeatures(100.0, 0.0, 1, 1, List.of("consistent_lp", ScoreResult.TAG_INACTIVE));

        assertThatThrownBy(() -> new ScoreResult(100.0, features))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("negative score is rejected")
    void negativeScore() {
        ScoreFeatures features = new ScoreFeatures(0.0, 0.0, 0, 0, List.of(ScoreResult.TAG_INACTIVE));

        assertThatThrownBy(() -> new ScoreResult(-1.0, features))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    @DisplayName("duplicate tags collapse in insertion order")
    void tagsDeduplicated() {
        ScoreFeatures features = new ScoreFeatures(100.0, 100.0, 2, 2,
                List.of("consistent_lp", "consistent_trader", "consistent_lp"));

        assertThat(new ScoreResult(100.0, features).features().userTags())
                .containsExactly("consistent_lp", "consistent_trader");
    }
}
