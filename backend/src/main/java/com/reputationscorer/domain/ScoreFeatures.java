package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Per-wallet DEX features behind a score. Tags keep insertion order and never repeat.
 */
@JsonPropertyOrder({"active_days", "lp_score", "swap_score", "total_transaction_count", "user_tags"})
public record ScoreFeatures(
        @JsonProperty("lp_score") double lpScore,
        @JsonProperty("swap_score") double swapScore,
        @JsonProperty("active_days") int activeDays,
        @JsonProperty("total_transaction_count") int totalTransactionCount,
        @JsonProperty("user_tags") List<String> userTags) {

    public ScoreFeatures {
        if (lpScore < 0 || swapScore < 0) {
            throw new IllegalArgumentException("sub-scores must not be negative");
        }
        userTags = userTags == null ? List.of() : List.copyOf(new LinkedHashSet<>(userTags));
    }

    public boolean hasTag(String tag) {
        return userTags.contains(tag);
    }
}
