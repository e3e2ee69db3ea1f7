package com.reputationscorer.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reputationscorer.common.RetryPolicy;
import com.reputationscorer.config.AsyncConfig;
import com.reputationscorer.domain.ScoreEnvelope;
import com.reputationscorer.domain.ScoreSuccessEnvelope;
import com.reputationscorer.domain.WalletActivity;
import com.reputationscorer.scoring.ReputationScoringEngine;
import com.reputationscorer.stats.ProcessingStats;
import com.reputationscorer.stream.channel.ActivityChannel;
import com.reputationscorer.stream.channel.ActivityChannelFactory;
import com.reputationscorer.stream.channel.ChannelException;
import com.reputationscorer.stream.channel.InboundMessage;
import com.reputationscorer.stream.config.StreamProperties;
import com.reputationscorer.stream.envelope.ScoreEnvelopeFactory;
import com.reputationscorer.stream.validation.ActivityMessageValidator;
import com.reputationscorer.stream.validation.SchemaValidationException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single worker loop: poll → validate → score → publish envelope → acknowledge → stats.
 * Messages are handled strictly in delivery order. A bad message yields a failure envelope and
 * never stops the loop; a channel failure closes the session and reconnects after backoff.
 * Offsets are committed only after publish, so delivery is at-least-once.
 */
@Component
@Slf4j
public class ActivityStreamProcessor {

    private final ActivityChannelFactory channelFactory;
    private final ActivityMessageValidator messageValidator;
    private final ReputationScoringEngine scoringEngine;
    private final ScoreEnvelopeFactory envelopeFactory;
    private final ProcessingStats processingStats;
    private final StreamProperties streamProperties;
    private final RetryPolicy reconnectRetryPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile ProcessorState state = ProcessorState.STARTING;
    private volatile ActivityChannel currentChannel;
    private volatile int consecutiveChannelFailures;

    public ActivityStreamProcessor(ActivityChannelFactory channelFactory,
                                   ActivityMessageValidator messageValidator,
                                   ReputationScoringEngine scoringEngine,
                                   ScoreEnvelopeFactory envelopeFactory,
                                   ProcessingStats processingStats,
                                   StreamProperties streamProperties,
                                   RetryPolicy reconnectRetryPolicy,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   @Qualifier(AsyncConfig.STREAM_PROCESSOR_EXECUTOR) Executor executor) {
        this.channelFactory = channelFactory;
        this.messageValidator = messageValidator;
        this.scoringEngine = scoringEngine;
        this.envelopeFactory = envelopeFactory;
        this.processingStats = processingStats;
        this.streamProperties = streamProperties;
        this.reconnectRetryPolicy = reconnectRetryPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!streamProperties.isEnabled()) {
            log.info("Stream processor disabled (reputation.stream.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        log.info("Starting stream processor on topic {}", streamProperties.getInputTopic());
        executor.execute(this::runLoop);
    }

    /**
     * Stops pulling new messages, lets the in-flight message finish publishing and waits for the loop to exit.
     */
    @PreDestroy
    public void stop() {
        requestStop();
        if (!started.get()) return;
        try {
            if (!terminated.await(streamProperties.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Stream processor did not stop within {} ms", streamProperties.getShutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Non-blocking stop signal, observed at the next poll.
     */
    public void requestStop() {
        if (stopRequested) return;
        stopRequested = true;
        stopSignal.countDown();
        ActivityChannel channel = currentChannel;
        if (channel != null) {
            channel.wakeup();
        }
    }

    public ProcessorState getState() {
        return state;
    }

    /**
     * True once consecutive channel failures reach the escalation threshold; cleared by the next successful poll.
     */
    public boolean isDegraded() {
        return consecutiveChannelFailures >= reconnectRetryPolicy.getMaxAttempts();
    }

    void runLoop() {
        Duration pollTimeout = Duration.ofMillis(streamProperties.getPollTimeoutMs());
        try {
            while (!stopRequested) {
                try (ActivityChannel channel = channelFactory.open()) {
                    currentChannel = channel;
                    if (stopRequested) break;
                    transition(ProcessorState.RUNNING);
                    consume(channel, pollTimeout);
                } catch (ChannelException e) {
                    currentChannel = null;
                    if (stopRequested) break;
                    onChannelFailure(e);
                } catch (RuntimeException e) {
                    currentChannel = null;
                    if (stopRequested) break;
                    log.error("Unexpected stream processor failure, restarting session", e);
                    onChannelFailure(e);
                }
            }
        } finally {
            currentChannel = null;
            transition(ProcessorState.STOPPED);
            terminated.countDown();
            log.info("Stream processor stopped");
        }
    }

    private void consume(ActivityChannel channel, Duration pollTimeout) {
        while (!stopRequested) {
            List<InboundMessage> batch = channel.poll(pollTimeout);
            consecutiveChannelFailures = 0;
            if (batch.isEmpty()) continue;
            log.debug("Polled {} message(s)", batch.size());
            for (InboundMessage message : batch) {
                if (stopRequested) break;
                try {
                    handle(channel, message);
                } catch (ChannelException e) {
                    commitAcknowledged(channel, e);
                    throw e;
                }
            }
            channel.commit();
        }
        // messages polled but not handled are redelivered to the next consumer
        transition(ProcessorState.STOPPING);
        channel.commit();
    }

    /**
     * Best-effort commit of messages already published in this batch, so a mid-batch failure only replays the rest.
     */
    private void commitAcknowledged(ActivityChannel channel, ChannelException cause) {
        try {
            channel.commit();
        } catch (ChannelException commitFailure) {
            log.warn("Could not commit published offsets after channel failure: {}", commitFailure.getMessage());
            cause.addSuppressed(commitFailure);
        }
    }

    private void onChannelFailure(RuntimeException e) {
        int failures = ++consecutiveChannelFailures;
        transition(ProcessorState.RECONNECTING);
        long delayMs = reconnectRetryPolicy.delayMs(failures - 1);
        if (isDegraded()) {
            log.error("Stream channel failed {} consecutive time(s), still retrying in {} ms: {}",
                    failures, delayMs, e.getMessage());
        } else {
            log.warn("Stream channel failure (attempt {}), reconnecting in {} ms: {}", failures, delayMs, e.getMessage());
        }
        try {
            stopSignal.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    /**
     * Publishes exactly one envelope for the message, then acknowledges it and records stats.
     * Only channel failures escape.
     */
    void handle(ActivityChannel channel, InboundMessage message) {
        ScoreEnvelope envelope = evaluate(message);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Processing failed: cannot serialize envelope for wallet {}", envelope.walletAddress(), e);
            envelope = envelopeFactory.failure(envelope.walletAddress(), "envelope serialization failed: " + e.getOriginalMessage());
            payload = serializeFailure(envelope);
        }
        boolean success = envelope instanceof ScoreSuccessEnvelope;
        String topic = success ? streamProperties.getSuccessTopic() : streamProperties.getFailureTopic();

        channel.publish(topic, envelope.walletAddress(), payload);
        channel.acknowledge(message);

        long messageTimestamp = message.hasTimestamp()
                ? message.timestampMs() / 1000
                : clock.instant().getEpochSecond();
        if (success) {
            processingStats.recordSuccess(messageTimestamp);
            log.info("Published success for wallet {}", envelope.walletAddress());
        } else {
            processingStats.recordFailure(messageTimestamp);
            log.info("Published failure for wallet {}", envelope.walletAddress());
        }
    }

    private ScoreEnvelope evaluate(InboundMessage message) {
        WalletActivity activity = null;
        try {
            activity = messageValidator.validate(message.payload());
            String walletAddress = activity.walletAddress();
            log.debug("Scoring wallet {} (partition {}, offset {})", walletAddress, message.partition(), message.offset());
            return scoringEngine.score(activity)
                    .<ScoreEnvelope>map(result -> envelopeFactory.success(walletAddress, result))
                    .orElseGet(() -> envelopeFactory.missingDexData(walletAddress));
        } catch (SchemaValidationException e) {
            log.error("Processing failed: invalid message for wallet {}: {}", e.getWalletAddress(), e.getMessage());
            return envelopeFactory.failure(e.getWalletAddress(), e.getMessage());
        } catch (RuntimeException e) {
            String walletAddress = activity != null ? activity.walletAddress() : ActivityMessageValidator.UNKNOWN_WALLET;
            log.error("Processing failed for wallet {}", walletAddress, e);
            return envelopeFactory.failure(walletAddress, describe(e));
        }
    }

    private String serializeFailure(ScoreEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize failure envelope for wallet " + envelope.walletAddress(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void transition(ProcessorState next) {
        ProcessorState previous = state;
        if (previous == next) return;
        state = next;
        log.debug("Stream processor {} -> {}", previous, next);
    }
}
