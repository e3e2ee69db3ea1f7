package com.reputationscorer.stream.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Kafka channel and processing loop settings. Topic names and broker come from
 * KAFKA_BROKER, KAFKA_INPUT_TOPIC, KAFKA_SUCCESS_TOPIC, KAFKA_FAILURE_TOPIC (see application.yml).
 */
@ConfigurationProperties(prefix = "reputation.stream")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StreamProperties {

    /** Start the processor on application ready. Disabled in tests that only need the API. */
    private boolean enabled = true;

    @NotBlank
    private String bootstrapServers = "localhost:9092";

    @NotBlank
    private String inputTopic = "wallet-transactions";

    @NotBlank
    private String successTopic = "wallet-scores-success";

    @NotBlank
    private String failureTopic = "wallet-scores-failure";

    @NotBlank
    private String groupId = "reputation-scorer-group";

    /** Where a new consumer group starts reading. */
    private String autoOffsetReset = "earliest";

    /** Max time a single poll blocks waiting for records. */
    @Positive
    private long pollTimeoutMs = 1_000;

    /** How long shutdown waits for the in-flight message to publish and the loop to exit. */
    @Positive
    private long shutdownTimeoutMs = 30_000;

    @NotNull
    private MissingDexDataPolicy missingDexDataPolicy = MissingDexDataPolicy.EMPTY_SUCCESS;
}
