package com.prakash.studyplanner.controller;

import com.prakash.studyplanner.dto.PlannedTaskRequest;
import com.prakash.studyplanner.dto.PlannedTaskResponse;
import com.prakash.studyplanner.dto.PlannedTaskUpdateRequest;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.service.PlannedTaskService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/tasks") // Base path for the planned-task calendar
public class PlannedTaskController {

    private static final Logger log = LoggerFactory.getLogger(PlannedTaskController.class);

    private final PlannedTaskService plannedTaskService;

    @Autowired
    public PlannedTaskController(PlannedTaskService plannedTaskService) {
        this.plannedTaskService = plannedTaskService;
    }

    /**
     * Lists the caller's planned tasks.
     *
     * @param date      Optional single day filter.
     * @param startDate Optional range start, used together with {@code endDate}.
     * @param endDate   Optional range end, inclusive.
     * @return Tasks in date/start order.
     */
    @GetMapping
    public ResponseEntity<List<PlannedTaskResponse>> getTasks(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        String userId = RequestUser.require(userHeader);
        log.debug("Received request to get planned tasks of user {}. date={}, range={}..{}", userId, date, startDate, endDate);
        List<PlannedTask> tasks = plannedTaskService.getTasks(userId, date, startDate, endDate);
        return ResponseEntity.ok(tasks.stream()
                .map(PlannedTaskResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public ResponseEntity<PlannedTaskResponse> createTask(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody PlannedTaskRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to create planned task '{}' for user {}", request.getTitle(), userId);
        PlannedTask created = plannedTaskService.createTask(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PlannedTaskResponse.fromEntity(created));
    }

    /**
     * Partial update: completion flag, reschedule, title or notes.
     */
    @PatchMapping("/{id}")
    public ResponseEntity<PlannedTaskResponse> updateTask(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id,
            @RequestBody PlannedTaskUpdateRequest request) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to update planned task {} of user {}", id, userId);
        return ResponseEntity.ok(PlannedTaskResponse.fromEntity(plannedTaskService.updateTask(userId, id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTask(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id) {
        String userId = RequestUser.require(userHeader);
        log.info("Received request to delete planned task {} of user {}", id, userId);
        plannedTaskService.deleteTask(userId, id);
        return ResponseEntity.noContent().build();
    }
}
