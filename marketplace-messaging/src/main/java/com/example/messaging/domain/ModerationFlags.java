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
public class ModerationFlags implements Serializable {

    private String flaggedBy;
    private String reason;
    private Instant flaggedAt;
}
