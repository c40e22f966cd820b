package com.example.messaging.controller;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.dto.CreateFilterRuleRequest;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.ParticipantIdentityService;
import com.example.messaging.service.exception.NotFoundException;
import com.example.messaging.service.moderation.ContentFilterEngine;
import com.example.messaging.service.moderation.FilterRule;
import com.example.messaging.service.moderation.FilterRuleRegistry;
import com.example.messaging.service.moderation.ViolationStats;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/moderation")
public class ModerationController {

    private final FilterRuleRegistry ruleRegistry;
    private final ContentFilterEngine contentFilter;
    private final MessagingService messagingService;
    private final ParticipantIdentityService participantIdentityService;

    public ModerationController(
            FilterRuleRegistry ruleRegistry,
            ContentFilterEngine contentFilter,
            MessagingService messagingService,
            ParticipantIdentityService participantIdentityService) {
        this.ruleRegistry = ruleRegistry;
        this.contentFilter = contentFilter;
        this.messagingService = messagingService;
        this.participantIdentityService = participantIdentityService;
    }

    @GetMapping("/rules")
    public ResponseEntity<List<FilterRule>> listRules(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        participantIdentityService.requireAdmin(authorization);
        return ResponseEntity.ok(ruleRegistry.activeRules());
    }

    @PostMapping("/rules")
    public ResponseEntity<FilterRule> addRule(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @Valid @RequestBody CreateFilterRuleRequest request) {
        participantIdentityService.requireAdmin(authorization);
        FilterRule rule = ruleRegistry.addCustomRule(FilterRule.builder()
                .pattern(request.getPattern())
                .category(request.getCategory())
                .severity(request.getSeverity())
                .action(request.getAction())
                .replacement(request.getReplacement())
                .description(request.getDescription())
                .caseInsensitive(request.isCaseInsensitive())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(rule);
    }

    @DeleteMapping("/rules/{ruleId}")
    public ResponseEntity<Void> removeRule(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String ruleId) {
        participantIdentityService.requireAdmin(authorization);
        if (!ruleRegistry.removeCustomRule(ruleId)) {
            throw new NotFoundException("Custom filter rule %s not found".formatted(ruleId));
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Violation counts over the submitted text of every message in the conversation.
     */
    @GetMapping("/conversations/{conversationId}/stats")
    public ResponseEntity<ViolationStats> conversationStats(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        AuthenticatedPrincipal principal = participantIdentityService.resolveAuthorization(authorization);
        messagingService.getConversation(principal, conversationId);
        List<String> texts = messagingService.listMessages(principal, conversationId).stream()
                .map(message -> message.getOriginalContent() != null ? message.getOriginalContent() : message.getContent())
                .toList();
        return ResponseEntity.ok(contentFilter.statistics(texts));
    }
}
