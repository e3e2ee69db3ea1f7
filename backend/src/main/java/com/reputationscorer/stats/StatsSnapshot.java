package com.reputationscorer.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Read-only view of processing counters. {@code lastProcessedTimestamp} is null until the first message.
 */
@JsonPropertyOrder({"processed_count", "success_count", "failure_count", "last_processed_timestamp"})
public record StatsSnapshot(
        @JsonProperty("processed_count") long processedCount,
        @JsonProperty("success_count") long successCount,
        @JsonProperty("failure_count") long failureCount,
        @JsonProperty("last_processed_timestamp") Long lastProcessedTimestamp) {
}
