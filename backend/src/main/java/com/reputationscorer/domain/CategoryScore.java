package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Score block for one scored protocol family inside a success envelope.
 */
@JsonPropertyOrder({"category", "score", "transaction_count", "features"})
public record CategoryScore(
        String category,
        double score,
        @JsonProperty("transaction_count") int transactionCount,
        ScoreFeatures features) {
}
