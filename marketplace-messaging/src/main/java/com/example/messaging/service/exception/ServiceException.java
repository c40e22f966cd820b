package com.example.messaging.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A failure the caller can act on. REST renders it as {@code {error, code}} with {@link #getStatus()};
 * Socket.IO acknowledgements carry the same code.
 */
public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
