package com.studyspots.exception;

import org.springframework.http.HttpStatus;

public class InvalidInputException extends ApiException {

    public InvalidInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
