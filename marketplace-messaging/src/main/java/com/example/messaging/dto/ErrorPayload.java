package com.example.messaging.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Failure reported back over the socket, shaped like the REST error body.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorPayload {
    String code;
    String error;
    Set<String> categories;
}
