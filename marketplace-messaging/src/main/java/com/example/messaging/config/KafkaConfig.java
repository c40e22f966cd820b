package com.example.messaging.config;

import com.example.messaging.event.ChatEvent;
import com.example.messaging.event.ChatMessageEvent;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ChatEvent> chatEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(producerProperties(properties));
    }

    @Bean
    public KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate(
            ProducerFactory<String, ChatEvent> chatEventProducerFactory) {
        return new KafkaTemplate<>(chatEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, ChatMessageEvent> chatMessageProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(producerProperties(properties));
    }

    @Bean
    public KafkaTemplate<String, ChatMessageEvent> chatMessageKafkaTemplate(
            ProducerFactory<String, ChatMessageEvent> chatMessageProducerFactory) {
        return new KafkaTemplate<>(chatMessageProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(MessagingProperties messagingProperties) {
        return TopicBuilder.name(messagingProperties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic messageTopic(MessagingProperties messagingProperties) {
        return TopicBuilder.name(messagingProperties.getKafka().getMessageTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }

    private Map<String, Object> producerProperties(KafkaProperties properties) {
        Map<String, Object> producer = properties.buildProducerProperties();
        producer.putIfAbsent(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producer.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        producer.putIfAbsent(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        return producer;
    }
}
