package com.reputationscorer.scoring;

import java.util.Arrays;

/**
 * Sub-score kinds with their percentile bucket scores, lowest bucket first.
 * LP and swap tables differ only in the 75–95 percentile range.
 */
public enum ScoreType {

    LP_SCORE("lp_score", new int[]{150, 250, 350, 450, 550, 650, 750, 850, 950, 1000}),
    SWAP_SCORE("swap_score", new int[]{150, 250, 350, 450, 550, 650, 800, 900, 950, 1000});

    private final String wireName;
    private final int[] bucketScores;

    ScoreType(String wireName, int[] bucketScores) {
        this.wireName = wireName;
        this.bucketScores = bucketScores;
    }

    public String wireName() {
        return wireName;
    }

    int bucketScore(int bucket) {
        return bucketScores[bucket];
    }

    int bucketCount() {
        return bucketScores.length;
    }

    public static ScoreType fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown score type: " + name));
    }
}
