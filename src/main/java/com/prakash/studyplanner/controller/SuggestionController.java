package com.prakash.studyplanner.controller;

import com.prakash.studyplanner.dto.GenerateSuggestionsResponse;
import com.prakash.studyplanner.dto.ResolveSuggestionRequest;
import com.prakash.studyplanner.dto.ResolveSuggestionResponse;
import com.prakash.studyplanner.dto.SuggestionResponse;
import com.prakash.studyplanner.service.SuggestionGenerationService;
import com.prakash.studyplanner.service.SuggestionResolutionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/schedule")
public class SuggestionController {

    private static final Logger log = LoggerFactory.getLogger(SuggestionController.class);

    private final SuggestionGenerationService generationService;
    private final SuggestionResolutionService resolutionService;

    @Autowired
    public SuggestionController(SuggestionGenerationService generationService,
                                SuggestionResolutionService resolutionService) {
        this.generationService = generationService;
        this.resolutionService = resolutionService;
    }

    /**
     * Proposes study sessions for the caller's open assignments.
     *
     * @return The proposals with optional insights, or 400 with {@code needsSchedule=true}
     * when no weekly schedule has been set up.
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerateSuggestionsResponse> generateSuggestions(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to generate suggestions for user {}", userId);
        return ResponseEntity.ok(generationService.generate(userId));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<List<SuggestionResponse>> getPendingSuggestions(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        log.debug("Received request to list pending suggestions for user {}", userId);
        return ResponseEntity.ok(generationService.listPending(userId));
    }

    /**
     * Accepts or dismisses one suggestion, or all pending ones.
     * Body: {@code {"suggestionId": "...", "action": "accept|dismiss|acceptAll|dismissAll"}}.
     */
    @PostMapping("/suggestions")
    public ResponseEntity<ResolveSuggestionResponse> resolveSuggestion(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody ResolveSuggestionRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request from user {} to {} suggestion {}", userId, request.getAction(), request.getSuggestionId());
        return ResponseEntity.ok(resolutionService.resolve(userId, request));
    }
}
