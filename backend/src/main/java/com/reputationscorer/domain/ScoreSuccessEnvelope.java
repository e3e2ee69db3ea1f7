package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Published to the success topic. {@code zscore} is the final score with exactly 18 fractional digits.
 */
@JsonPropertyOrder({"wallet_address", "zscore", "timestamp", "categories"})
public record ScoreSuccessEnvelope(
        @JsonProperty("wallet_address") String walletAddress,
        String zscore,
        long timestamp,
        List<CategoryScore> categories) implements ScoreEnvelope {

    public ScoreSuccessEnvelope {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
