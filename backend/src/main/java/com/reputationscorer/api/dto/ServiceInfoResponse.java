package com.reputationscorer.api.dto;

/**
 * GET / body: service identity, description and liveness.
 */
public record ServiceInfoResponse(String service, String description, String version, String status) {
}
