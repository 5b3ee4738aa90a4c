package com.prakash.studyplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when suggestions are requested before the user has configured any weekly availability.
 * Reported separately from other failures so the client can send the user to the schedule setup.
 */
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class NeedsSetupException extends RuntimeException {

    public NeedsSetupException(String message) {
        super(message);
    }
}
