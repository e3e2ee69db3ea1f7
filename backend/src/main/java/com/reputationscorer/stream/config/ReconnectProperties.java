package com.reputationscorer.stream.config;

import com.reputationscorer.common.RetryPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff between reconnect attempts after a channel failure. The processor retries forever;
 * after {@code escalateAfterAttempts} consecutive failures it reports itself degraded.
 */
@ConfigurationProperties(prefix = "reputation.stream.reconnect")
@NoArgsConstructor
@Getter
@Setter
public class ReconnectProperties {

    /** FIXED or EXPONENTIAL. Default FIXED. */
    private RetryPolicy.BackoffStrategy strategy = RetryPolicy.BackoffStrategy.FIXED;

    /** Delay before the first reconnect; constant for FIXED, doubled per attempt for EXPONENTIAL. Default 5000. */
    private long baseDelayMs = 5_000L;

    /** Ceiling for EXPONENTIAL backoff. Default 60000. */
    private long maxDelayMs = 60_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0. */
    private double jitterFactor = 0.0;

    /** Consecutive failures before the processor reports degraded. Default 5. */
    private int escalateAfterAttempts = 5;
}
