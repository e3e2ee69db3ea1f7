package com.reputationscorer.stream.envelope;

import com.reputationscorer.domain.CategoryScore;
import com.reputationscorer.domain.ProtocolActivity;
import com.reputationscorer.domain.ScoreEnvelope;
import com.reputationscorer.domain.ScoreFailureEnvelope;
import com.reputationscorer.domain.ScoreResult;
import com.reputationscorer.domain.ScoreSuccessEnvelope;
import com.reputationscorer.stream.config.MissingDexDataPolicy;
import com.reputationscorer.stream.config.StreamProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;

/**
 * Builds outbound envelopes stamped with the current time (epoch seconds).
 */
@Component
@RequiredArgsConstructor
public class ScoreEnvelopeFactory {

    public static final String NO_DEX_DATA_ERROR = "no dex data for wallet";

    private static final int ZSCORE_SCALE = 18;

    private final StreamProperties streamProperties;
    private final Clock clock;

    public ScoreSuccessEnvelope success(String walletAddress, ScoreResult result) {
        CategoryScore dexes = new CategoryScore(
                ProtocolActivity.DEXES,
                result.finalScore(),
                result.features().totalTransactionCount(),
                result.features());
        return new ScoreSuccessEnvelope(walletAddress, formatZscore(result.finalScore()), now(), List.of(dexes));
    }

    /**
     * Envelope for a wallet without a "dexes" block, per the configured {@link MissingDexDataPolicy}.
     */
    public ScoreEnvelope missingDexData(String walletAddress) {
        if (streamProperties.getMissingDexDataPolicy() == MissingDexDataPolicy.FAILURE) {
            return failure(walletAddress, NO_DEX_DATA_ERROR);
        }
        return new ScoreSuccessEnvelope(walletAddress, formatZscore(0.0), now(), List.of());
    }

    public ScoreFailureEnvelope failure(String walletAddress, String error) {
        return new ScoreFailureEnvelope(walletAddress, now(), error);
    }

    /**
     * Exact binary value of the score, rounded half-even to 18 fractional digits, no exponent.
     */
    public static String formatZscore(double score) {
        return new BigDecimal(score).setScale(ZSCORE_SCALE, RoundingMode.HALF_EVEN).toPlainString();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
