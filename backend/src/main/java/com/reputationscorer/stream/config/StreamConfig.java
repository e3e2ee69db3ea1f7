package com.reputationscorer.stream.config;

import com.reputationscorer.common.RetryPolicy;
import com.reputationscorer.stream.channel.ActivityChannelFactory;
import com.reputationscorer.stream.channel.KafkaActivityChannelFactory;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka client factories and reconnect policy for the activity stream.
 * Values are plain strings on the wire; JSON mapping happens in the processor.
 */
@Configuration
@EnableConfigurationProperties({ StreamProperties.class, ReconnectProperties.class })
public class StreamConfig {

    @Bean
    public ConsumerFactory<String, String> activityConsumerFactory(StreamProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getGroupId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, properties.getAutoOffsetReset());
        // offsets are committed only after the outcome envelope is published
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public ProducerFactory<String, String> scoreProducerFactory(StreamProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public ActivityChannelFactory activityChannelFactory(ConsumerFactory<String, String> activityConsumerFactory,
                                                         ProducerFactory<String, String> scoreProducerFactory,
                                                         StreamProperties properties) {
        return new KafkaActivityChannelFactory(activityConsumerFactory, scoreProducerFactory, properties.getInputTopic());
    }

    @Bean
    public RetryPolicy reconnectRetryPolicy(ReconnectProperties properties) {
        return new RetryPolicy(
                properties.getStrategy(),
                properties.getBaseDelayMs(),
                properties.getMaxDelayMs(),
                properties.getJitterFactor(),
                properties.getEscalateAfterAttempts());
    }
}
