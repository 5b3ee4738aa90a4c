package com.prakash.studyplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class SchedulePersistenceException extends RuntimeException {

    public SchedulePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
