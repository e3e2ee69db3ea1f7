package com.reputationscorer.stream.channel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.util.List;

/**
 * Creates a subscribed consumer plus a producer for each session.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaActivityChannelFactory implements ActivityChannelFactory {

    private final ConsumerFactory<String, String> consumerFactory;
    private final ProducerFactory<String, String> producerFactory;
    private final String inputTopic;

    @Override
    public ActivityChannel open() {
        Consumer<String, String> consumer = null;
        try {
            consumer = consumerFactory.createConsumer();
            consumer.subscribe(List.of(inputTopic));
            Producer<String, String> producer = producerFactory.createProducer();
            log.info("Kafka channel opened: subscribed to {}", inputTopic);
            return new KafkaActivityChannel(consumer, producer, producerFactory);
        } catch (KafkaException e) {
            if (consumer != null) {
                closeQuietly(consumer);
            }
            throw new ChannelException("Failed to open Kafka channel for " + inputTopic, e);
        }
    }

    private static void closeQuietly(Consumer<String, String> consumer) {
        try {
            consumer.close();
        } catch (KafkaException e) {
            log.warn("Failed to close Kafka consumer after open failure: {}", e.getMessage());
        }
    }
}
