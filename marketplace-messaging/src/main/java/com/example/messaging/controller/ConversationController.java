package com.example.messaging.controller;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.dto.ConversationSummary;
import com.example.messaging.dto.CreateConversationRequest;
import com.example.messaging.dto.MarkConversationReadResponse;
import com.example.messaging.dto.SendMessageRequest;
import com.example.messaging.service.MessageDraft;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.ParticipantIdentityService;
import com.example.messaging.service.attachment.AttachmentService;
import com.example.messaging.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final MessagingService messagingService;
    private final AttachmentService attachmentService;
    private final ParticipantIdentityService participantIdentityService;

    public ConversationController(
            MessagingService messagingService,
            AttachmentService attachmentService,
            ParticipantIdentityService participantIdentityService) {
        this.messagingService = messagingService;
        this.attachmentService = attachmentService;
        this.participantIdentityService = participantIdentityService;
    }

    @GetMapping
    public ResponseEntity<List<ConversationSummary>> listConversations(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        return ResponseEntity.ok(messagingService.listConversations(principal));
    }

    @PostMapping
    public ResponseEntity<Conversation> createConversation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @Valid @RequestBody CreateConversationRequest request) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        Conversation conversation = messagingService.createConversation(
                principal, request.otherParticipants(), request.getProjectId(), request.getProjectTitle());
        return ResponseEntity.ok(conversation);
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<Conversation> getConversation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        return ResponseEntity.ok(messagingService.getConversation(principal, conversationId));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<ChatMessage>> getMessages(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        return ResponseEntity.ok(messagingService.listMessages(principal, conversationId));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId,
            @Valid @RequestBody SendMessageRequest request) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        ChatMessage message = messagingService.sendMessage(principal, MessageDraft.builder()
                .conversationId(conversationId)
                .receiverId(request.getReceiverId())
                .type(request.getType())
                .content(request.getContent())
                .metadata(request.getMetadata())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @PostMapping(path = "/{conversationId}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ChatMessage> uploadAttachment(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId,
            @RequestPart("file") MultipartFile file,
            @RequestParam(name = "receiverId", required = false) String receiverId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        if (file == null || file.isEmpty()) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "No file provided", "INVALID_FILE");
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read upload", ex);
        }
        ChatMessage message = attachmentService.sendFile(principal, conversationId, receiverId, content,
                file.getOriginalFilename(), file.getContentType());
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @PostMapping("/{conversationId}/read")
    public ResponseEntity<MarkConversationReadResponse> markConversationRead(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        int marked = messagingService.markConversationRead(principal, conversationId);
        return ResponseEntity.ok(MarkConversationReadResponse.builder()
                .conversationId(conversationId)
                .markedRead(marked)
                .build());
    }
}
