package com.reputationscorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;

/**
 * DeFi reputation scoring service: consumes wallet DEX activity, publishes score envelopes.
 * Kafka clients are built by {@link com.reputationscorer.stream.config.StreamConfig}, not auto-configured.
 */
@SpringBootApplication(exclude = KafkaAutoConfiguration.class)
public class ReputationScorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReputationScorerApplication.class, args);
    }
}
