package com.reputationscorer.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service identity reported by GET /. Overridable via API_TITLE, API_DESCRIPTION, API_VERSION.
 */
@ConfigurationProperties(prefix = "reputation.api")
@NoArgsConstructor
@Getter
@Setter
public class ServiceInfoProperties {

    private String title = "DeFi Reputation Scoring Server";

    private String description = "A microservice to calculate wallet reputation scores using AI.";

    private String version = "1.0.0";
}
