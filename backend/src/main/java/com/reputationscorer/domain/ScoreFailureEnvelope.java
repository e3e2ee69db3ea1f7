package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Published to the failure topic when a message could not be scored.
 */
@JsonPropertyOrder({"wallet_address", "timestamp", "error"})
public record ScoreFailureEnvelope(
        @JsonProperty("wallet_address") String walletAddress,
        long timestamp,
        String error) implements ScoreEnvelope {
}
