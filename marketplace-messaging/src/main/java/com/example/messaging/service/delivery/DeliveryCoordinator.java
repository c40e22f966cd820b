package com.example.messaging.service.delivery;

import com.example.messaging.config.MessagingModuleConfig;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.dto.ReadReceipt;
import com.example.messaging.event.ChatEvent;
import com.example.messaging.event.ChatEventListener;
import com.example.messaging.event.ChatMessageEvent;
import com.example.messaging.service.notification.NotificationService;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Reacts to persisted messages and lifecycle changes: pushes them to live connections on the delivery pool
 * and falls back to email when the receiver could not be reached.
 */
@Slf4j
@Component
public class DeliveryCoordinator implements ChatEventListener {

    public static final String MESSAGE_SENT_EVENT = "message_sent";
    public static final String CONVERSATION_CREATED_EVENT = "conversation_created";
    public static final String MESSAGE_READ_EVENT = "message_read";

    private final RealtimeBroadcaster broadcaster;
    private final NotificationService notificationService;
    private final Executor deliveryExecutor;

    public DeliveryCoordinator(
            RealtimeBroadcaster broadcaster,
            NotificationService notificationService,
            @Qualifier(MessagingModuleConfig.DELIVERY_EXECUTOR) Executor deliveryExecutor) {
        this.broadcaster = broadcaster;
        this.notificationService = notificationService;
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void onMessageEvent(ChatMessageEvent event) {
        submit("message " + event.getMessage().getId(), () -> deliver(event.getMessage()));
    }

    @Override
    public void onLifecycleEvent(ChatEvent event) {
        switch (event.getType()) {
            case CONVERSATION_CREATED -> {
                if (event.getPayload().get("conversation") instanceof Conversation conversation) {
                    submit("conversation " + conversation.getId(), () -> conversation.getParticipants()
                            .forEach(participant -> broadcaster.pushToUser(participant, CONVERSATION_CREATED_EVENT, conversation)));
                }
            }
            case MESSAGE_READ -> {
                if (event.getPayload().get("receipt") instanceof ReadReceipt receipt) {
                    String senderId = (String) event.getPayload().get("senderId");
                    submit("receipt " + receipt.getMessageId(),
                            () -> broadcaster.pushToUser(senderId, MESSAGE_READ_EVENT, receipt));
                }
            }
            default -> {
            }
        }
    }

    void deliver(ChatMessage message) {
        broadcaster.pushToUser(message.getSenderId(), MESSAGE_SENT_EVENT, message);
        if (broadcaster.deliver(message)) {
            log.debug("Delivered message {} live to {}", message.getId(), message.getReceiverId());
            return;
        }
        notificationService.notifyIfDue(message);
    }

    private void submit(String description, Runnable task) {
        try {
            deliveryExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    log.warn("Delivery of {} failed", description, ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Delivery queue full, dropping live delivery of {}", description);
        }
    }
}
