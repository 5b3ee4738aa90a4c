package com.prakash.studyplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class AvailabilityBlockNotFoundException extends RuntimeException {

    public AvailabilityBlockNotFoundException(String message) {
        super(message);
    }
}
