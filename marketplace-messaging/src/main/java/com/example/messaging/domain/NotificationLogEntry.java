package com.example.messaging.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLogEntry implements Serializable {

    private String recipientEmail;
    private String conversationId;
    private Instant sentAt;
}
