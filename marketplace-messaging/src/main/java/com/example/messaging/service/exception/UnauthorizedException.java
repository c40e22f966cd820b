package com.example.messaging.service.exception;

import org.springframework.http.HttpStatus;

/**
 * The acting user is not a participant of the conversation it tried to use.
 */
public class UnauthorizedException extends ServiceException {

    public static final String CODE = "UNAUTHORIZED";

    public UnauthorizedException(String message) {
        super(HttpStatus.FORBIDDEN, message, CODE);
    }
}
