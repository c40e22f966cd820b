package com.example.messaging.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MarkReadPayload {

    @NotBlank
    private String messageId;
}
