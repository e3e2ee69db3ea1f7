package com.reputationscorer.scoring;

import com.reputationscorer.domain.ProtocolActivity;
import com.reputationscorer.domain.ScoreFeatures;
import com.reputationscorer.domain.ScoreResult;
import com.reputationscorer.domain.Transaction;
import com.reputationscorer.domain.WalletActivity;
import com.reputationscorer.scoring.config.ScoringProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scores a wallet from its "dexes" activity.
 * <ul>
 *   <li>lp_score = points per action × liquidity actions (add/remove liquidity)</li>
 *   <li>swap_score = points per action × swap actions</li>
 *   <li>final = weighted sum when both are positive, else the positive one, else 0 and tagged inactive</li>
 * </ul>
 * Pure and deterministic; cost is linear in the number of transactions.
 */
@Component
@RequiredArgsConstructor
public class ReputationScoringEngine {

    public static final String TAG_CONSISTENT_LP = "consistent_lp";
    public static final String TAG_CONSISTENT_TRADER = "consistent_trader";

    private static final long SECONDS_PER_DAY = 86_400L;

    private final ScoringProperties scoringProperties;

    /**
     * @return empty when the wallet has no "dexes" block; a result (possibly inactive) otherwise
     */
    public Optional<ScoreResult> score(WalletActivity activity) {
        return activity.findProtocol(ProtocolActivity.DEXES).map(this::scoreDexActivity);
    }

    ScoreResult scoreDexActivity(ProtocolActivity dexActivity) {
        List<Transaction> transactions = dexActivity.transactions() == null ? List.of() : dexActivity.transactions();
        if (transactions.isEmpty()) {
            return ScoreResult.inactive();
        }

        int liquidityActions = 0;
        int swapActions = 0;
        Set<Long> activeDays = new HashSet<>();
        for (Transaction tx : transactions) {
            if (tx.isLiquidityAction()) {
                liquidityActions++;
            } else if (tx.isSwapAction()) {
                swapActions++;
            }
            if (tx.timestamp() != null) {
                activeDays.add(Math.floorDiv(tx.timestamp(), SECONDS_PER_DAY));
            }
        }

        double lpScore = liquidityActions * scoringProperties.getPointsPerAction();
        double swapScore = swapActions * scoringProperties.getPointsPerAction();

        List<String> tags = new ArrayList<>();
        if (liquidityActions > 0) tags.add(TAG_CONSISTENT_LP);
        if (swapActions > 0) tags.add(TAG_CONSISTENT_TRADER);

        double finalScore = combine(lpScore, swapScore);
        if (finalScore == 0.0 && !tags.contains(ScoreResult.TAG_INACTIVE)) {
            tags.add(ScoreResult.TAG_INACTIVE);
        }

        ScoreFeatures features = new ScoreFeatures(lpScore, swapScore, activeDays.size(), transactions.size(), tags);
        return new ScoreResult(finalScore, features);
    }

    private double combine(double lpScore, double swapScore) {
        if (lpScore > 0 && swapScore > 0) {
            return lpScore * scoringProperties.getLpWeight() + swapScore * scoringProperties.getSwapWeight();
        }
        if (lpScore > 0) return lpScore;
        if (swapScore > 0) return swapScore;
        return 0.0;
    }
}
