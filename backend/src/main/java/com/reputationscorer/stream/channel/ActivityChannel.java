package com.reputationscorer.stream.channel;

import java.time.Duration;
import java.util.List;

/**
 * Connection to the message broker for one processing session: consumes the input topic and
 * publishes to output topics. Opened by {@link ActivityChannelFactory}, closed when the session ends.
 * All transport errors surface as {@link ChannelException}.
 */
public interface ActivityChannel extends AutoCloseable {

    /**
     * Blocks up to {@code timeout} for the next records. Returns an empty list after {@link #wakeup()}.
     */
    List<InboundMessage> poll(Duration timeout);

    /**
     * Publishes a record and blocks until the broker acknowledges it.
     */
    void publish(String topic, String key, String payload);

    /**
     * Marks a message as fully handled; its offset becomes eligible for {@link #commit()}.
     */
    void acknowledge(InboundMessage message);

    /**
     * Commits offsets of acknowledged messages.
     */
    void commit();

    /**
     * Interrupts a blocked {@link #poll(Duration)} from another thread.
     */
    void wakeup();

    @Override
    void close();
}
