package com.reputationscorer.stream.channel;

/**
 * One record received from the input topic, value still raw JSON.
 *
 * @param timestampMs broker/producer timestamp in epoch millis, negative when absent
 */
public record InboundMessage(String topic, int partition, long offset, String key, String payload, long timestampMs) {

    public boolean hasTimestamp() {
        return timestampMs >= 0;
    }
}
