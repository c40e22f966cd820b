package com.example.messaging.controller;

import com.example.messaging.service.ParticipantIdentityService;
import com.example.messaging.service.notification.DigestScheduler;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/digest")
public class DigestController {

    private final DigestScheduler digestScheduler;
    private final ParticipantIdentityService participantIdentityService;

    public DigestController(DigestScheduler digestScheduler, ParticipantIdentityService participantIdentityService) {
        this.digestScheduler = digestScheduler;
        this.participantIdentityService = participantIdentityService;
    }

    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        participantIdentityService.requireAdmin(authorization);
        return ResponseEntity.ok(Map.of("sent", digestScheduler.triggerNow()));
    }
}
