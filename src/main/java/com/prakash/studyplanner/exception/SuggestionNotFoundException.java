package com.prakash.studyplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND) // Also used for suggestions owned by someone else
public class SuggestionNotFoundException extends RuntimeException {

    public SuggestionNotFoundException(String message) {
        super(message);
    }
}
