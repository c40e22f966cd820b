package com.example.messaging.service.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ServiceException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message, CODE);
    }
}
