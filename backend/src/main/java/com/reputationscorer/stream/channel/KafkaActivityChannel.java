package com.reputationscorer.stream.channel;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Kafka-backed channel. Not thread-safe except {@link #wakeup()}; owned by the processor thread.
 * Offsets are tracked per partition and committed synchronously, only for acknowledged messages.
 */
@Slf4j
public class KafkaActivityChannel implements ActivityChannel {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final Consumer<String, String> consumer;
    private final Producer<String, String> producer;
    private final ProducerFactory<String, String> producerFactory;
    private final Map<TopicPartition, OffsetAndMetadata> pendingOffsets = new HashMap<>();

    KafkaActivityChannel(Consumer<String, String> consumer,
                         Producer<String, String> producer,
                         ProducerFactory<String, String> producerFactory) {
        this.consumer = consumer;
        this.producer = producer;
        this.producerFactory = producerFactory;
    }

    @Override
    public List<InboundMessage> poll(Duration timeout) {
        ConsumerRecords<String, String> records;
        try {
            records = consumer.poll(timeout);
        } catch (WakeupException e) {
            return List.of();
        } catch (KafkaException e) {
            throw new ChannelException("Kafka poll failed", e);
        }
        List<InboundMessage> messages = new ArrayList<>(records.count());
        for (ConsumerRecord<String, String> r : records) {
            messages.add(new InboundMessage(r.topic(), r.partition(), r.offset(), r.key(), r.value(), r.timestamp()));
        }
        return messages;
    }

    @Override
    public void publish(String topic, String key, String payload) {
        try {
            producer.send(new ProducerRecord<>(topic, key, payload)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new ChannelException("Kafka publish to " + topic + " failed", e.getCause());
        } catch (KafkaException e) {
            throw new ChannelException("Kafka publish to " + topic + " failed", e);
        }
    }

    @Override
    public void acknowledge(InboundMessage message) {
        pendingOffsets.put(new TopicPartition(message.topic(), message.partition()),
                new OffsetAndMetadata(message.offset() + 1));
    }

    @Override
    public void commit() {
        if (pendingOffsets.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = Map.copyOf(pendingOffsets);
        try {
            commitOffsets(offsets);
        } catch (WakeupException e) {
            // a pending wakeup aborts the first blocking call; the retry is not affected
            commitOffsets(offsets);
        }
        pendingOffsets.clear();
    }

    private void commitOffsets(Map<TopicPartition, OffsetAndMetadata> offsets) {
        try {
            consumer.commitSync(offsets);
        } catch (WakeupException e) {
            throw e;
        } catch (KafkaException e) {
            throw new ChannelException("Kafka offset commit failed", e);
        }
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        try {
            consumer.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            log.warn("Kafka consumer close failed: {}", e.getMessage());
        }
        try {
            producer.flush();
            producer.close(CLOSE_TIMEOUT);
            // drops the shared producer so the next session starts with a fresh connection
            producerFactory.reset();
        } catch (KafkaException e) {
            log.warn("Kafka producer close failed: {}", e.getMessage());
        }
        log.info("Kafka channel closed");
    }
}
