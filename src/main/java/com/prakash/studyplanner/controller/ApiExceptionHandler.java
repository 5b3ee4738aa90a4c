package com.prakash.studyplanner.controller;

import com.prakash.studyplanner.dto.ErrorResponse;
import com.prakash.studyplanner.exception.AvailabilityBlockNotFoundException;
import com.prakash.studyplanner.exception.InvalidRequestException;
import com.prakash.studyplanner.exception.NeedsSetupException;
import com.prakash.studyplanner.exception.PlannedTaskNotFoundException;
import com.prakash.studyplanner.exception.SchedulePersistenceException;
import com.prakash.studyplanner.exception.SuggestionNotFoundException;
import com.prakash.studyplanner.exception.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Renders every failure as {@code {"error": "...", "needsSchedule": false}} with the matching status.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(NeedsSetupException.class)
    public ResponseEntity<ErrorResponse> handleNeedsSetup(NeedsSetupException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage(), true));
    }

    @ExceptionHandler({SuggestionNotFoundException.class, PlannedTaskNotFoundException.class,
            AvailabilityBlockNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(" "));
        return ResponseEntity.badRequest().body(ErrorResponse.of(details.isEmpty() ? "Invalid request" : details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        log.warn("Rejected malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request"));
    }

    @ExceptionHandler(SchedulePersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(SchedulePersistenceException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of("Storage failure"));
    }
}
