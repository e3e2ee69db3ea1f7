package com.reputationscorer.scoring.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Weights and thresholds for DEX reputation scoring.
 * Weights apply when both LP and swap sub-scores are positive.
 */
@ConfigurationProperties(prefix = "reputation.scoring")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ScoringProperties {

    /** Weight of lp_score in the combined score. Default 0.6. */
    @Positive
    private double lpWeight = 0.6;

    /** Weight of swap_score in the combined score. Default 0.4. */
    @Positive
    private double swapWeight = 0.4;

    /** Raw points per liquidity or swap action. Default 100. */
    @Positive
    private double pointsPerAction = 100.0;

    /**
     * Minimum activity for the "consistent" tags. Reported as configuration only:
     * tags are granted on the first matching action.
     */
    private Threshold lp = new Threshold(15, 5);

    private Threshold swap = new Threshold(10, 5);

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Threshold {

        @PositiveOrZero
        private int activeDaysMin;

        @PositiveOrZero
        private int minTxCount;

        public Threshold(int activeDaysMin, int minTxCount) {
            this.activeDaysMin = activeDaysMin;
            this.minTxCount = minTxCount;
        }
    }
}
