package com.example.messaging.dto;

import com.example.messaging.domain.ParticipantType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SocketHandshakeResponse {
    String userId;
    ParticipantType type;
    String connectionId;
}
