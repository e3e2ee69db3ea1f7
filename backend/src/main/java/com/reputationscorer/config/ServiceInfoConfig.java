package com.reputationscorer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ServiceInfoProperties.class)
public class ServiceInfoConfig {
}
