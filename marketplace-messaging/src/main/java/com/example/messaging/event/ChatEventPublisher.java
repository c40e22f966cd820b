package com.example.messaging.event;

import com.example.messaging.config.MessagingProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans events out to in-process listeners and to Kafka. Neither a failing listener nor an unreachable broker
 * is reported to the publisher: by the time an event is published its state change is already durable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final List<ChatEventListener> listeners;
    private final KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate;
    private final KafkaTemplate<String, ChatMessageEvent> chatMessageKafkaTemplate;
    private final MessagingProperties properties;

    public void publishLifecycleEvent(ChatEvent event) {
        for (ChatEventListener listener : listeners) {
            try {
                listener.onLifecycleEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {} event {}", listener.getClass().getSimpleName(),
                        event.getType(), event.getEventId(), ex);
            }
        }
        String topic = properties.getKafka().getLifecycleTopic();
        try {
            chatEventKafkaTemplate.send(topic, event.key(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} event {} to {}", event.getType(), event.getEventId(), topic, ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} event {} to {}", event.getType(), event.getEventId(), topic, ex);
        }
    }

    public void publishMessageEvent(ChatMessageEvent event) {
        for (ChatEventListener listener : listeners) {
            try {
                listener.onMessageEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on message event {}", listener.getClass().getSimpleName(),
                        event.getEventId(), ex);
            }
        }
        String topic = properties.getKafka().getMessageTopic();
        try {
            chatMessageKafkaTemplate.send(topic, event.getConversationId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish message event {} to {}", event.getEventId(), topic, ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish message event {} to {}", event.getEventId(), topic, ex);
        }
    }
}
