package com.example.messaging.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.HandshakeData;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.messaging.config.MessagingSecurityProperties;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.domain.ParticipantType;
import com.example.messaging.dto.ChatMessagePayload;
import com.example.messaging.dto.CreateConversationRequest;
import com.example.messaging.dto.ErrorPayload;
import com.example.messaging.dto.MarkReadPayload;
import com.example.messaging.dto.SocketHandshakeResponse;
import com.example.messaging.event.ChatEventPublisher;
import com.example.messaging.service.JwtIdentityVerifier;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.ParticipantIdentityService;
import com.example.messaging.service.presence.PresenceTracker;
import com.example.messaging.support.MessagingFixture;
import com.example.messaging.support.TestTokens;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SocketIoMessagingGatewayTest {

    private MessagingFixture fixture;
    private TestTokens tokens;
    private PresenceTracker presence;
    private SocketIoMessagingGateway gateway;

    @BeforeEach
    void setUp() {
        fixture = new MessagingFixture();
        MessagingSecurityProperties security = new MessagingSecurityProperties();
        security.setTokenSecret(TestTokens.SECRET);
        tokens = new TestTokens(fixture.clock);
        JwtIdentityVerifier verifier = new JwtIdentityVerifier(security, fixture.clock);
        presence = new PresenceTracker();
        MessagingService messaging = new MessagingService(fixture.conversationStore, fixture.messageStore,
                mock(ChatEventPublisher.class), fixture.clock);
        gateway = new SocketIoMessagingGateway(mock(SocketIOServer.class), new ParticipantIdentityService(verifier),
                presence, messaging);
    }

    @Test
    void validTokenRegistersPresence() {
        SocketIOClient client = client(tokens.issue("talent", ParticipantType.TALENT, Duration.ofHours(1)));

        gateway.handleConnect(client);

        assertThat(presence.isOnline("talent")).isTrue();
        ArgumentCaptor<Object> ready = ArgumentCaptor.forClass(Object.class);
        verify(client).sendEvent(eq(SocketIoMessagingGateway.SESSION_READY_EVENT), ready.capture());
        assertThat(((SocketHandshakeResponse) ready.getValue()).getUserId()).isEqualTo("talent");
        verify(client, never()).disconnect();
    }

    @Test
    void invalidTokenIsRejected() {
        SocketIOClient client = client("forged.token");

        gateway.handleConnect(client);

        verify(client).sendEvent(eq(SocketIoMessagingGateway.CONNECTION_ERROR_EVENT), any(ErrorPayload.class));
        verify(client).disconnect();
        assertThat(presence.onlineUserCount()).isZero();
    }

    @Test
    void disconnectRemovesOnlyThatSocket() {
        String token = tokens.issue("talent", ParticipantType.TALENT, Duration.ofHours(1));
        SocketIOClient laptop = client(token);
        SocketIOClient phone = client(token);
        gateway.handleConnect(laptop);
        gateway.handleConnect(phone);

        gateway.handleDisconnect(laptop);
        assertThat(presence.isOnline("talent")).isTrue();

        gateway.handleDisconnect(phone);
        assertThat(presence.isOnline("talent")).isFalse();
    }

    @Test
    void sendMessageAcknowledgesStoredMessage() {
        SocketIOClient client = connected("client", ParticipantType.CLIENT);
        Conversation conversation = fixture.conversationStore.findOrCreate(List.of("client", "talent"), null, null).conversation();
        ChatMessagePayload payload = new ChatMessagePayload();
        payload.setConversationId(conversation.getId());
        payload.setContent("Can you do a British accent?");
        AckRequest ack = ack();

        gateway.handleSendMessage(client, payload, ack);

        ArgumentCaptor<Object> result = ArgumentCaptor.forClass(Object.class);
        verify(ack).sendAckData(result.capture());
        ChatMessage message = (ChatMessage) result.getValue();
        assertThat(message.getSenderId()).isEqualTo("client");
        assertThat(message.getReceiverId()).isEqualTo("talent");
    }

    @Test
    void blockedMessageReportsCategories() {
        SocketIOClient client = connected("client", ParticipantType.CLIENT);
        Conversation conversation = fixture.conversationStore.findOrCreate(List.of("client", "talent"), null, null).conversation();
        ChatMessagePayload payload = new ChatMessagePayload();
        payload.setConversationId(conversation.getId());
        payload.setContent("text me on whatsapp casey77");
        AckRequest ack = ack();

        gateway.handleSendMessage(client, payload, ack);

        ArgumentCaptor<Object> result = ArgumentCaptor.forClass(Object.class);
        verify(ack).sendAckData(result.capture());
        ErrorPayload error = (ErrorPayload) result.getValue();
        assertThat(error.getCode()).isEqualTo("CONTENT_BLOCKED");
        assertThat(error.getCategories()).containsExactly("EXTERNAL_PLATFORM");
        verify(client).sendEvent(eq(SocketIoMessagingGateway.MESSAGE_ERROR_EVENT), any(ErrorPayload.class));
        assertThat(fixture.messages.size()).isZero();
    }

    @Test
    void createConversationAndMarkRead() {
        SocketIOClient client = connected("client", ParticipantType.CLIENT);
        CreateConversationRequest request = new CreateConversationRequest();
        request.setRecipientId("talent");
        AckRequest createAck = ack();

        gateway.handleCreateConversation(client, request, createAck);

        ArgumentCaptor<Object> created = ArgumentCaptor.forClass(Object.class);
        verify(createAck).sendAckData(created.capture());
        Conversation conversation = (Conversation) created.getValue();
        assertThat(conversation.getParticipants()).containsExactly("client", "talent");

        SocketIOClient talent = connected("talent", ParticipantType.TALENT);
        ChatMessagePayload payload = new ChatMessagePayload();
        payload.setConversationId(conversation.getId());
        payload.setContent("hello");
        gateway.handleSendMessage(client, payload, null);
        String messageId = fixture.messageStore.listByConversation(conversation.getId(), "talent").get(0).getId();

        MarkReadPayload read = new MarkReadPayload();
        read.setMessageId(messageId);
        AckRequest readAck = ack();
        gateway.handleMarkRead(talent, read, readAck);

        ArgumentCaptor<Object> marked = ArgumentCaptor.forClass(Object.class);
        verify(readAck).sendAckData(marked.capture());
        assertThat(marked.getValue()).isEqualTo(Map.of("messageId", messageId, "marked", true));
    }

    @Test
    void unauthenticatedSocketCannotSend() {
        SocketIOClient client = client("unused");
        ChatMessagePayload payload = new ChatMessagePayload();
        payload.setConversationId("c1");
        payload.setContent("hi");
        AckRequest ack = ack();

        gateway.handleSendMessage(client, payload, ack);

        ArgumentCaptor<Object> result = ArgumentCaptor.forClass(Object.class);
        verify(ack).sendAckData(result.capture());
        assertThat(((ErrorPayload) result.getValue()).getCode()).isEqualTo(ParticipantIdentityService.UNAUTHENTICATED);
    }

    private SocketIOClient connected(String userId, ParticipantType type) {
        SocketIOClient client = client(tokens.issue(userId, type, Duration.ofHours(1)));
        gateway.handleConnect(client);
        return client;
    }

    private static SocketIOClient client(String token) {
        SocketIOClient client = mock(SocketIOClient.class);
        HandshakeData handshake = mock(HandshakeData.class);
        when(handshake.getSingleUrlParam("token")).thenReturn(token);
        when(client.getHandshakeData()).thenReturn(handshake);
        when(client.getSessionId()).thenReturn(UUID.randomUUID());
        when(client.isChannelOpen()).thenReturn(true);
        Map<String, Object> attributes = new HashMap<>();
        doAnswer(invocation -> attributes.put(invocation.getArgument(0), invocation.getArgument(1)))
                .when(client).set(anyString(), any());
        doAnswer(invocation -> attributes.get(invocation.<String>getArgument(0)))
                .when(client).get(anyString());
        return client;
    }

    private static AckRequest ack() {
        AckRequest ack = mock(AckRequest.class);
        when(ack.isAckRequested()).thenReturn(true);
        return ack;
    }
}
