package com.reputationscorer.domain;

import java.util.List;

/**
 * Final reputation score plus the features it was derived from. Built once per wallet per message.
 */
public record ScoreResult(double finalScore, ScoreFeatures features) {

    public static final String TAG_INACTIVE = "inactive";

    public ScoreResult {
        if (finalScore < 0) {
            throw new IllegalArgumentException("finalScore must not be negative");
        }
        if (features == null) {
            throw new IllegalArgumentException("features are required");
        }
        if ((finalScore == 0.0) != features.hasTag(TAG_INACTIVE)) {
            throw new IllegalArgumentException("finalScore is 0 exactly when tagged " + TAG_INACTIVE);
        }
    }

    /** Result for a DEX block without transactions. */
    public static ScoreResult inactive() {
        return new ScoreResult(0.0, new ScoreFeatures(0.0, 0.0, 0, 0, List.of(TAG_INACTIVE)));
    }

    public boolean isInactive() {
        return features.hasTag(TAG_INACTIVE);
    }
}
