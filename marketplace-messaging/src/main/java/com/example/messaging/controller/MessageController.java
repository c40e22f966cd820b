package com.example.messaging.controller;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.ParticipantIdentityService;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final MessagingService messagingService;
    private final ParticipantIdentityService participantIdentityService;

    public MessageController(MessagingService messagingService, ParticipantIdentityService participantIdentityService) {
        this.messagingService = messagingService;
        this.participantIdentityService = participantIdentityService;
    }

    /**
     * Idempotent: reading an already read message, or one addressed to someone else, reports
     * {@code marked=false}.
     */
    @PutMapping("/{messageId}/read")
    public ResponseEntity<Map<String, Object>> markRead(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String messageId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        boolean marked = messagingService.markRead(principal, messageId);
        return ResponseEntity.ok(Map.of("messageId", messageId, "marked", marked));
    }
}
