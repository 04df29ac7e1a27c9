package com.studyspots.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for domain failures. Each subclass maps to exactly one HTTP status.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
