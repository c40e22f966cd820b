package com.example.messaging.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.ChatMessageType;
import com.example.messaging.domain.Conversation;
import com.example.messaging.service.exception.ContentBlockedException;
import com.example.messaging.service.exception.NotFoundException;
import com.example.messaging.service.exception.ServiceException;
import com.example.messaging.service.exception.UnauthorizedException;
import com.example.messaging.service.moderation.FilterCategory;
import com.example.messaging.support.MessagingFixture;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageStoreTest {

    private MessagingFixture fixture;
    private MessageStore store;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        fixture = new MessagingFixture();
        store = fixture.messageStore;
        conversation = fixture.conversationStore.findOrCreate(List.of("u1", "u2"), null, null).conversation();
    }

    @Test
    void storesRedactedContentAndKeepsOriginal() {
        ChatMessage message = store.append(draft("u1", "u2", "email me at a@b.com"));

        assertThat(message.getContent()).isEqualTo("email me at [EMAIL REMOVED - Please use platform messaging]");
        assertThat(message.getOriginalContent()).isEqualTo("email me at a@b.com");
        assertThat(message.isFiltered()).isTrue();
        assertThat(message.getModeration().getFlaggedBy()).isEqualTo("content-filter");
        assertThat(message.getModeration().getReason()).isEqualTo("EMAIL");
        assertThat(store.listByConversation(conversation.getId(), "u2")).containsExactly(message);
    }

    @Test
    void redactedMessageSerializesWithoutOriginalText() throws JsonProcessingException {
        store.append(draft("u1", "u2", "email me at a@b.com"));

        String json = MessagingFixture.objectMapper()
                .writeValueAsString(store.listByConversation(conversation.getId(), "u2"));

        assertThat(json).contains("[EMAIL REMOVED - Please use platform messaging]");
        assertThat(json).doesNotContain("a@b.com").doesNotContain("originalContent").doesNotContain("\"read\"");
    }

    @Test
    void cleanMessageIsStoredUntouched() {
        ChatMessage message = store.append(draft("u1", "u2", "Script attached, budget is $500."));

        assertThat(message.isFiltered()).isFalse();
        assertThat(message.getOriginalContent()).isNull();
        assertThat(message.getModeration()).isNull();
        assertThat(message.getSequence()).isEqualTo(1);
        assertThat(message.isRead()).isFalse();
    }

    @Test
    void blockedMessageIsNeverPersisted() {
        assertThatThrownBy(() -> store.append(draft("u1", "u2", "add me on whatsapp janedoe99")))
                .isInstanceOfSatisfying(ContentBlockedException.class,
                        ex -> assertThat(ex.getCategories()).containsExactly(FilterCategory.EXTERNAL_PLATFORM));

        assertThat(fixture.messages.size()).isZero();
        assertThat(store.listByConversation(conversation.getId(), "u1")).isEmpty();
    }

    @Test
    void rejectsSenderOutsideConversation() {
        assertThatThrownBy(() -> store.append(draft("intruder", "u2", "hello")))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(fixture.messages.size()).isZero();
    }

    @Test
    void rejectsUnknownConversation() {
        MessageDraft draft = MessageDraft.builder().conversationId("nope").senderId("u1").content("hi").build();

        assertThatThrownBy(() -> store.append(draft)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void infersReceiverInTwoPartyConversation() {
        ChatMessage message = store.append(draft("u2", null, "hi"));

        assertThat(message.getReceiverId()).isEqualTo("u1");
    }

    @Test
    void requiresReceiverToBeAnotherParticipant() {
        assertThatThrownBy(() -> store.append(draft("u1", "outsider", "hi")))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("INVALID_MESSAGE");
        assertThatThrownBy(() -> store.append(draft("u1", "u1", "hi")))
                .isInstanceOf(ServiceException.class);
    }

    @Test
    void validatesPaymentMetadata() {
        MessageDraft missingAmount = MessageDraft.builder()
                .conversationId(conversation.getId())
                .senderId("u1")
                .type(ChatMessageType.PAYMENT_REQUEST)
                .content("Invoice for chapter one")
                .metadata(Map.of("currency", "USD"))
                .build();

        assertThatThrownBy(() -> store.append(missingAmount)).hasMessageContaining("amount");

        ChatMessage ok = store.append(MessageDraft.builder()
                .conversationId(conversation.getId())
                .senderId("u1")
                .type(ChatMessageType.PAYMENT_REQUEST)
                .content("Invoice for chapter one")
                .metadata(Map.of("amount", "120.00", "currency", "USD"))
                .build());
        assertThat(ok.getType()).isEqualTo(ChatMessageType.PAYMENT_REQUEST);
        assertThat(ok.getMetadata()).containsEntry("currency", "USD");
    }

    @Test
    void messagesComeBackInSendOrder() {
        ChatMessage first = store.append(draft("u1", "u2", "one"));
        ChatMessage second = store.append(draft("u2", "u1", "two"));
        fixture.clock.advance(Duration.ofSeconds(1));
        ChatMessage third = store.append(draft("u1", "u2", "three"));

        assertThat(store.listByConversation(conversation.getId(), "u1"))
                .extracting(ChatMessage::getId)
                .containsExactly(first.getId(), second.getId(), third.getId());
        assertThat(third.getSequence()).isEqualTo(3);
    }

    @Test
    void nonParticipantsSeeNothing() {
        store.append(draft("u1", "u2", "private"));

        assertThat(store.listByConversation(conversation.getId(), "u3")).isEmpty();
        assertThat(store.listByConversation("unknown", "u1")).isEmpty();
    }

    @Test
    void concurrentAppendsGetDistinctGapFreeSequences() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 100; i++) {
                String sender = i % 2 == 0 ? "u1" : "u2";
                String body = "message " + i;
                pool.submit(() -> store.append(draft(sender, null, body)));
            }
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.listByConversation(conversation.getId(), "u1"))
                .extracting(ChatMessage::getSequence)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, 100).boxed().toList());
    }

    @Test
    void markReadOnlyByReceiverAndOnlyOnce() {
        ChatMessage message = store.append(draft("u1", "u2", "hello"));
        fixture.clock.advance(Duration.ofMinutes(5));

        assertThat(store.markRead(message.getId(), "u1")).isEmpty();
        assertThat(store.find(message.getId()).orElseThrow().isRead()).isFalse();

        ChatMessage read = store.markRead(message.getId(), "u2").orElseThrow();
        assertThat(read.getReadAt()).isEqualTo(fixture.clock.instant());

        fixture.clock.advance(Duration.ofMinutes(5));
        assertThat(store.markRead(message.getId(), "u2")).isEmpty();
        assertThat(store.find(message.getId()).orElseThrow().getReadAt()).isEqualTo(read.getReadAt());
    }

    @Test
    void markReadOfUnknownMessageFails() {
        assertThatThrownBy(() -> store.markRead("ghost", "u2")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void markConversationReadTouchesOnlyMessagesToTheUser() {
        store.append(draft("u1", "u2", "one"));
        store.append(draft("u1", "u2", "two"));
        ChatMessage reply = store.append(draft("u2", "u1", "three"));

        assertThat(store.unreadCounts("u2")).containsEntry(conversation.getId(), 2L);
        assertThat(store.markConversationRead(conversation.getId(), "u2")).hasSize(2);
        assertThat(store.unreadCounts("u2")).doesNotContainKey(conversation.getId());
        assertThat(store.find(reply.getId()).orElseThrow().isRead()).isFalse();
        assertThat(store.markConversationRead(conversation.getId(), "outsider")).isEmpty();
    }

    @Test
    void appendBumpsConversationActivity() {
        fixture.clock.advance(Duration.ofHours(2));
        store.append(draft("u1", "u2", "later"));

        assertThat(fixture.conversationStore.get(conversation.getId()).getLastActivityAt()).isEqualTo(fixture.clock.instant());
    }

    private MessageDraft draft(String sender, String receiver, String content) {
        return MessageDraft.builder()
                .conversationId(conversation.getId())
                .senderId(sender)
                .receiverId(receiver)
                .content(content)
                .build();
    }
}
