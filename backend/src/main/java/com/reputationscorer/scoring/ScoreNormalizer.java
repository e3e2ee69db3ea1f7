package com.reputationscorer.scoring;

import org.springframework.stereotype.Component;

/**
 * Maps a percentile rank (0–100) of a raw sub-score within the wallet population to a bounded
 * score of 150–1000 using half-open buckets [lower, upper).
 * Not wired into {@link ReputationScoringEngine}: it needs population statistics the service does not hold.
 */
@Component
public class ScoreNormalizer {

    private static final double[] BUCKET_BOUNDARIES = {0, 1, 5, 10, 25, 50, 75, 90, 95, 99, 100};
    private static final double TOP_PERCENTILE = 99.0;

    public int normalize(double percentile, ScoreType scoreType) {
        for (int i = 0; i < scoreType.bucketCount(); i++) {
            if (BUCKET_BOUNDARIES[i] <= percentile && percentile < BUCKET_BOUNDARIES[i + 1]) {
                return scoreType.bucketScore(i);
            }
        }
        if (percentile >= TOP_PERCENTILE) {
            return scoreType.bucketScore(scoreType.bucketCount() - 1);
        }
        return 0;
    }

    /**
     * @param scoreType "lp_score" or "swap_score"
     * @throws IllegalArgumentException for any other score type
     */
    public int normalize(double percentile, String scoreType) {
        return normalize(percentile, ScoreType.fromWireName(scoreType));
    }
}
