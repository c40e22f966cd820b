package com.example.messaging.service.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.dto.ReadReceipt;
import com.example.messaging.event.ChatEvent;
import com.example.messaging.event.ChatEventType;
import com.example.messaging.event.ChatMessageEvent;
import com.example.messaging.service.notification.NotificationService;
import com.example.messaging.service.presence.PresenceTracker;
import com.example.messaging.support.FakeConnectionHandle;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryCoordinatorTest {

    private PresenceTracker presence;
    private NotificationService notificationService;
    private DeliveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        presence = new PresenceTracker();
        notificationService = mock(NotificationService.class);
        coordinator = new DeliveryCoordinator(new RealtimeBroadcaster(presence), notificationService, Runnable::run);
    }

    @Test
    void onlineReceiverGetsMessageAndNoEmail() {
        FakeConnectionHandle receiver = new FakeConnectionHandle("r");
        FakeConnectionHandle sender = new FakeConnectionHandle("s");
        presence.markOnline("u2", receiver);
        presence.markOnline("u1", sender);
        ChatMessage message = message();

        coordinator.onMessageEvent(ChatMessageEvent.builder().message(message).conversationId("c1").build());

        assertThat(receiver.payloads(RealtimeBroadcaster.NEW_MESSAGE_EVENT)).containsExactly(message);
        assertThat(sender.payloads(DeliveryCoordinator.MESSAGE_SENT_EVENT)).containsExactly(message);
        verify(notificationService, never()).notifyIfDue(any());
    }

    @Test
    void offlineReceiverFallsBackToNotification() {
        ChatMessage message = message();

        coordinator.onMessageEvent(ChatMessageEvent.builder().message(message).conversationId("c1").build());

        verify(notificationService).notifyIfDue(message);
    }

    @Test
    void newConversationIsAnnouncedToEveryParticipant() {
        FakeConnectionHandle a = new FakeConnectionHandle("a");
        FakeConnectionHandle b = new FakeConnectionHandle("b");
        presence.markOnline("u1", a);
        presence.markOnline("u2", b);
        Conversation conversation = Conversation.builder().id("c1").participants(List.of("u1", "u2")).build();

        coordinator.onLifecycleEvent(ChatEvent.builder()
                .type(ChatEventType.CONVERSATION_CREATED)
                .conversationId("c1")
                .payload(Map.of("conversation", conversation))
                .build());

        assertThat(a.payloads(DeliveryCoordinator.CONVERSATION_CREATED_EVENT)).containsExactly(conversation);
        assertThat(b.payloads(DeliveryCoordinator.CONVERSATION_CREATED_EVENT)).containsExactly(conversation);
    }

    @Test
    void readReceiptGoesToTheSender() {
        FakeConnectionHandle sender = new FakeConnectionHandle("s");
        presence.markOnline("u1", sender);
        ReadReceipt receipt = ReadReceipt.builder()
                .messageId("m1").conversationId("c1").readerId("u2").readAt(Instant.EPOCH).build();

        coordinator.onLifecycleEvent(ChatEvent.builder()
                .type(ChatEventType.MESSAGE_READ)
                .conversationId("c1")
                .payload(Map.of("receipt", receipt, "senderId", "u1"))
                .build());

        assertThat(sender.payloads(DeliveryCoordinator.MESSAGE_READ_EVENT)).containsExactly(receipt);
    }

    @Test
    void rejectedDeliveryIsDroppedQuietly() {
        DeliveryCoordinator saturated = new DeliveryCoordinator(new RealtimeBroadcaster(presence), notificationService,
                task -> {
                    throw new RejectedExecutionException("full");
                });

        saturated.onMessageEvent(ChatMessageEvent.builder().message(message()).conversationId("c1").build());

        verify(notificationService, never()).notifyIfDue(any());
    }

    private static ChatMessage message() {
        return ChatMessage.builder().id("m1").conversationId("c1").senderId("u1").receiverId("u2").content("hi").build();
    }
}
