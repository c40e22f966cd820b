package com.example.messaging.service;

import com.example.messaging.domain.ChatMessageType;
import com.example.messaging.service.exception.ServiceException;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

/**
 * Checks that structured message kinds carry the metadata their renderers rely on.
 */
public final class MessageMetadataValidator {

    public static final String CODE = "INVALID_MESSAGE";

    private MessageMetadataValidator() {
    }

    public static void validate(ChatMessageType type, Map<String, Object> metadata) {
        switch (type) {
            case TEXT -> {
            }
            case FILE -> requireText(metadata, "fileId", type);
            case PAYMENT_REQUEST, PAYMENT_RELEASE -> {
                requirePositiveAmount(metadata, type);
                requireText(metadata, "currency", type);
            }
            case ESCROW_NOTICE -> requireText(metadata, "escrowId", type);
        }
    }

    private static void requireText(Map<String, Object> metadata, String field, ChatMessageType type) {
        Object value = metadata == null ? null : metadata.get(field);
        if (value == null || !StringUtils.hasText(value.toString())) {
            throw invalid("%s messages require metadata.%s".formatted(type, field));
        }
    }

    private static void requirePositiveAmount(Map<String, Object> metadata, ChatMessageType type) {
        Object value = metadata == null ? null : metadata.get("amount");
        if (value == null) {
            throw invalid("%s messages require metadata.amount".formatted(type));
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.toString());
        } catch (NumberFormatException ex) {
            throw invalid("metadata.amount must be a number");
        }
        if (amount.signum() <= 0) {
            throw invalid("metadata.amount must be positive");
        }
    }

    private static ServiceException invalid(String message) {
        return new ServiceException(HttpStatus.BAD_REQUEST, message, CODE);
    }
}
