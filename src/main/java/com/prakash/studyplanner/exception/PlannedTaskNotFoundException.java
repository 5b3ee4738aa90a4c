package com.prakash.studyplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class PlannedTaskNotFoundException extends RuntimeException {

    public PlannedTaskNotFoundException(String message) {
        super(message);
    }
}
