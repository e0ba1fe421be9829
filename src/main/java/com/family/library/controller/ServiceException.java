package com.family.library.controller;

import org.springframework.http.HttpStatus;

/**
 * Failure of a REST call, carrying the status to answer with.
 */
public class ServiceException extends RuntimeException {

    private final HttpStatus status;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null);
    }

    public ServiceException(HttpStatus status, String message, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
