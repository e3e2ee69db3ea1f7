package com.reputationscorer.stream.channel;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class KafkaActivityChannelTest {

    private static final String INPUT = "wallet-transactions";
    private static final TopicPartition PARTITION = new TopicPartition(INPUT, 0);

    private MockConsumer<String, String> consumer;
    private MockProducer<String, String> producer;
    private ProducerFactory<String, String> producerFactory;
    private KafkaActivityChannel channel;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.assign(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        producerFactory = mock(ProducerFactory.class);
        channel = new KafkaActivityChannel(consumer, producer, producerFactory);
    }

    @Test
    @DisplayName("poll maps records to inbound messages in order")
    void pollMapsRecords() {
        consumer.addRecord(new ConsumerRecord<>(INPUT, 0, 0L, "0xa", "{\"a\":1}"));
        consumer.addRecord(new ConsumerRecord<>(INPUT, 0, 1L, "0xb", "{\"b\":2}"));

        List<InboundMessage> messages = channel.poll(Duration.ofMillis(10));

        assertThat(messages).extracting(InboundMessage::offset).containsExactly(0L, 1L);
        assertThat(messages.get(0).payload()).isEqualTo("{\"a\":1}");
        assertThat(messages.get(0).hasTimestamp()).isFalse();
    }

    @Test
    @DisplayName("commit covers only acknowledged messages")
    void commitsAcknowledgedOffsets() {
        consumer.addRecord(new ConsumerRecord<>(INPUT, 0, 0L, "0xa", "one"));
        consumer.addRecord(new ConsumerRecord<>(INPUT, 0, 1L, "0xb", "two"));
        List<InboundMessage> messages = channel.poll(Duration.ofMillis(10));

        channel.acknowledge(messages.get(0));
        channel.commit();

        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Set.of(PARTITION));
        assertThat(committed.get(PARTITION).offset()).isEqualTo(1L);
    }

    @Test
    @DisplayName("wakeup makes a blocked poll return empty")
    void wakeupReturnsEmptyPoll() {
        consumer.addRecord(new ConsumerRecord<>(INPUT, 0, 0L, "0xa", "one"));
        channel.wakeup();

        assertThat(channel.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    @DisplayName("publish sends keyed record and waits for ack")
    void publishSends() {
        channel.publish("wallet-scores-success", "0xa", "{}");

        assertThat(producer.history()).containsExactly(new ProducerRecord<>("wallet-scores-success", "0xa", "{}"));
    }

    @Test
    @DisplayName("poll transport failure surfaces as ChannelException")
    void pollFailure() {
        consumer.setPollException(new KafkaException("broker unreachable"));

        assertThatThrownBy(() -> channel.poll(Duration.ofMillis(10)))
                .isInstanceOf(ChannelException.class)
                .hasCauseInstanceOf(KafkaException.class);
    }

    @Test
    @DisplayName("publish transport failure surfaces as ChannelException")
    void publishFailure() {
        producer.sendException = new KafkaException("broker unreachable");

        assertThatThrownBy(() -> channel.publish("wallet-scores-failure", "0xa", "{}"))
                .isInstanceOf(ChannelException.class);
    }

    @Test
    @DisplayName("close releases consumer, producer and the shared producer")
    void closeReleasesClients() {
        channel.close();

        assertThat(consumer.closed()).isTrue();
        assertThat(producer.closed()).isTrue();
        verify(producerFactory).reset();
    }
}
