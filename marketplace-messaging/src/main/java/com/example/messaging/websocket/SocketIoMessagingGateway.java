package com.example.messaging.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.dto.ChatMessagePayload;
import com.example.messaging.dto.CreateConversationRequest;
import com.example.messaging.dto.ErrorPayload;
import com.example.messaging.dto.MarkReadPayload;
import com.example.messaging.dto.SocketHandshakeResponse;
import com.example.messaging.service.MessageDraft;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.ParticipantIdentityService;
import com.example.messaging.service.exception.ContentBlockedException;
import com.example.messaging.service.exception.ServiceException;
import com.example.messaging.service.presence.PresenceTracker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Socket.IO transport. Authenticates each connection once, keeps presence in step with open sockets and
 * forwards client events to {@link MessagingService}. Outbound pushes go through the presence handles.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoMessagingGateway {

    static final String SEND_MESSAGE_EVENT = "send_message";
    static final String CREATE_CONVERSATION_EVENT = "create_conversation";
    static final String MARK_READ_EVENT = "mark_read";
    static final String SESSION_READY_EVENT = "session_ready";
    static final String MESSAGE_ERROR_EVENT = "message_error";
    static final String CONNECTION_ERROR_EVENT = "connection_error";

    private static final String PARAM_TOKEN = "token";
    private static final String PRINCIPAL_KEY = "principal";

    private final SocketIOServer socketIOServer;
    private final ParticipantIdentityService participantIdentityService;
    private final PresenceTracker presenceTracker;
    private final MessagingService messagingService;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(SEND_MESSAGE_EVENT, ChatMessagePayload.class, this::handleSendMessage);
        socketIOServer.addEventListener(CREATE_CONVERSATION_EVENT, CreateConversationRequest.class, this::handleCreateConversation);
        socketIOServer.addEventListener(MARK_READ_EVENT, MarkReadPayload.class, this::handleMarkRead);
    }

    void handleConnect(SocketIOClient client) {
        AuthenticatedPrincipal principal;
        try {
            principal = participantIdentityService.resolveToken(client.getHandshakeData().getSingleUrlParam(PARAM_TOKEN));
        } catch (ServiceException ex) {
            log.info("Rejected socket {}: {}", client.getSessionId(), ex.getMessage());
            client.sendEvent(CONNECTION_ERROR_EVENT, toError(ex));
            client.disconnect();
            return;
        }
        client.set(PRINCIPAL_KEY, principal);
        SocketIoConnectionHandle handle = new SocketIoConnectionHandle(client);
        presenceTracker.markOnline(principal.getUserId(), handle);
        client.sendEvent(SESSION_READY_EVENT, SocketHandshakeResponse.builder()
                .userId(principal.getUserId())
                .type(principal.getType())
                .connectionId(handle.id())
                .build());
        log.info("Socket {} connected for user {}", handle.id(), principal.getUserId());
    }

    void handleDisconnect(SocketIOClient client) {
        AuthenticatedPrincipal principal = client.get(PRINCIPAL_KEY);
        if (principal == null) {
            return;
        }
        presenceTracker.markOffline(principal.getUserId(), new SocketIoConnectionHandle(client));
        log.info("Socket {} disconnected for user {}", client.getSessionId(), principal.getUserId());
    }

    void handleSendMessage(SocketIOClient client, ChatMessagePayload payload, AckRequest ackSender) {
        respond(client, ackSender, () -> messagingService.sendMessage(principal(client), MessageDraft.builder()
                .conversationId(payload.getConversationId())
                .senderId(payload.getSenderId())
                .receiverId(payload.getReceiverId())
                .type(payload.getType())
                .content(payload.getContent())
                .metadata(payload.getMetadata())
                .build()));
    }

    void handleCreateConversation(SocketIOClient client, CreateConversationRequest request, AckRequest ackSender) {
        respond(client, ackSender, () -> messagingService.createConversation(
                principal(client), request.otherParticipants(), request.getProjectId(), request.getProjectTitle()));
    }

    void handleMarkRead(SocketIOClient client, MarkReadPayload payload, AckRequest ackSender) {
        respond(client, ackSender, () -> Map.of(
                "messageId", payload.getMessageId(),
                "marked", messagingService.markRead(principal(client), payload.getMessageId())));
    }

    private void respond(SocketIOClient client, AckRequest ackSender, Supplier<Object> action) {
        Object result;
        try {
            result = action.get();
        } catch (ServiceException ex) {
            log.debug("Socket {} request failed: {}", client.getSessionId(), ex.getMessage());
            ErrorPayload error = toError(ex);
            client.sendEvent(MESSAGE_ERROR_EVENT, error);
            result = error;
        } catch (RuntimeException ex) {
            log.error("Socket {} request failed", client.getSessionId(), ex);
            ErrorPayload error = ErrorPayload.builder().code("INTERNAL_ERROR").error("Internal error").build();
            client.sendEvent(MESSAGE_ERROR_EVENT, error);
            result = error;
        }
        if (ackSender != null && ackSender.isAckRequested()) {
            ackSender.sendAckData(result);
        }
    }

    private AuthenticatedPrincipal principal(SocketIOClient client) {
        AuthenticatedPrincipal principal = client.get(PRINCIPAL_KEY);
        if (principal == null) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "Socket is not authenticated",
                    ParticipantIdentityService.UNAUTHENTICATED);
        }
        return principal;
    }

    static ErrorPayload toError(ServiceException ex) {
        ErrorPayload.ErrorPayloadBuilder builder = ErrorPayload.builder()
                .code(ex.getErrorCode())
                .error(ex.getMessage());
        if (ex instanceof ContentBlockedException blocked) {
            builder.categories(blocked.getCategories().stream().map(Enum::name).collect(Collectors.toCollection(TreeSet::new)));
        }
        return builder.build();
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(SEND_MESSAGE_EVENT);
        socketIOServer.removeAllListeners(CREATE_CONVERSATION_EVENT);
        socketIOServer.removeAllListeners(MARK_READ_EVENT);
    }
}
