package com.reputationscorer.domain;

/**
 * Outbound record carrying the outcome of exactly one inbound message.
 */
public interface ScoreEnvelope {

    String walletAddress();

    /** Emission time, epoch seconds. */
    long timestamp();
}
