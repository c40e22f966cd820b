package com.example.messaging.service.exception;

import org.springframework.http.HttpStatus;

public class NotificationSendException extends ServiceException {

    public static final String CODE = "NOTIFICATION_SEND_FAILED";

    public NotificationSendException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, CODE, cause);
    }
}
