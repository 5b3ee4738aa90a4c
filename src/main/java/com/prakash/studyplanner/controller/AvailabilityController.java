package com.prakash.studyplanner.controller;

import com.prakash.studyplanner.dto.AvailabilityBlockRequest;
import com.prakash.studyplanner.dto.AvailabilityBlockResponse;
import com.prakash.studyplanner.dto.AvailabilityBlockUpdateRequest;
import com.prakash.studyplanner.dto.ReplaceScheduleRequest;
import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.service.AvailabilityService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/schedule") // Weekly availability blocks
public class AvailabilityController {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityController.class);

    private final AvailabilityService availabilityService;

    @Autowired
    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping
    public ResponseEntity<List<AvailabilityBlockResponse>> getSchedule(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        log.debug("Received request to get weekly schedule of user {}", userId);
        return ResponseEntity.ok(toResponses(availabilityService.getBlocks(userId)));
    }

    @PostMapping
    public ResponseEntity<AvailabilityBlockResponse> createBlock(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody AvailabilityBlockRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to add a {} block on day {} for user {}", request.getBlockType(), request.getDayOfWeek(), userId);
        AvailabilityBlock created = availabilityService.createBlock(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(AvailabilityBlockResponse.fromEntity(created));
    }

    /**
     * Replaces the whole weekly schedule with the given blocks.
     */
    @PutMapping
    public ResponseEntity<List<AvailabilityBlockResponse>> replaceSchedule(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody ReplaceScheduleRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to replace weekly schedule of user {} with {} blocks", userId, request.getBlocks().size());
        return ResponseEntity.ok(toResponses(availabilityService.replaceSchedule(userId, request.getBlocks())));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<AvailabilityBlockResponse> updateBlock(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id,
            @Valid @RequestBody AvailabilityBlockUpdateRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to update block {} of user {}", id, userId);
        return ResponseEntity.ok(AvailabilityBlockResponse.fromEntity(availabilityService.updateBlock(userId, id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBlock(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to delete block {} of user {}", id, userId);
        availabilityService.deleteBlock(userId, id);
        return ResponseEntity.noContent().build(); // 204
    }

    private List<AvailabilityBlockResponse> toResponses(List<AvailabilityBlock> blocks) {
        return blocks.stream()
                .map(AvailabilityBlockResponse::fromEntity)
                .collect(Collectors.toList());
    }
}
