package com.reputationscorer.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /api/v1/health body. {@code status} is "degraded" while the processor cannot reach the broker.
 */
public record HealthResponse(String status, @JsonProperty("processor_state") String processorState) {

    public static final String OK = "ok";
    public static final String DEGRADED = "degraded";
}
