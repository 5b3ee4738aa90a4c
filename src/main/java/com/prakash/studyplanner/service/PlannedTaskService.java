package com.prakash.studyplanner.service;

import com.prakash.studyplanner.dto.PlannedTaskRequest;
import com.prakash.studyplanner.dto.PlannedTaskUpdateRequest;
import com.prakash.studyplanner.exception.InvalidRequestException;
import com.prakash.studyplanner.exception.PlannedTaskNotFoundException;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.TaskType;
import com.prakash.studyplanner.repository.PlannedTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The user-facing side of the calendar: hand-made tasks, completion toggling, rescheduling
 * and deletion. Tasks from accepted suggestions are written by {@link SuggestionResolutionService}.
 */
@Service
public class PlannedTaskService {

    private static final Logger log = LoggerFactory.getLogger(PlannedTaskService.class);

    private static final Comparator<PlannedTask> CALENDAR_ORDER = Comparator
            .comparing(PlannedTask::getScheduledDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PlannedTask::getScheduledStart, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PlannedTaskRepository plannedTaskRepository;

    @Autowired
    public PlannedTaskService(PlannedTaskRepository plannedTaskRepository) {
        this.plannedTaskRepository = plannedTaskRepository;
    }

    /**
     * Lists tasks on one date, within an inclusive range, or all of them when no filter is given.
     * {@code date} wins over the range; a range needs both ends.
     */
    public List<PlannedTask> getTasks(String userId, LocalDate date, LocalDate startDate, LocalDate endDate) {
        List<PlannedTask> tasks;
        if (date != null) {
            log.debug("Fetching planned tasks of user {} on {}", userId, date);
            tasks = plannedTaskRepository.findByUserIdAndScheduledDate(userId, date);
        } else if (startDate != null && endDate != null) {
            if (endDate.isBefore(startDate)) {
                throw new InvalidRequestException("endDate must not be before startDate");
            }
            log.debug("Fetching planned tasks of user {} between {} and {}", userId, startDate, endDate);
            tasks = plannedTaskRepository.findByUserIdAndScheduledDateWithin(userId, startDate, endDate);
        } else {
            log.debug("Fetching all planned tasks of user {}", userId);
            tasks = plannedTaskRepository.findByUserId(userId);
        }
        return tasks.stream().sorted(CALENDAR_ORDER).collect(Collectors.toList());
    }

    public PlannedTask createTask(String userId, PlannedTaskRequest request) {
        requireValidRange(request.getScheduledStart(), request.getScheduledEnd());
        PlannedTask task = PlannedTask.builder()
                .userId(userId)
                .assignmentId(request.getAssignmentId())
                .title(request.getTitle())
                .taskType(request.getTaskType() != null ? request.getTaskType() : TaskType.ASSIGNMENT)
                .scheduledDate(request.getScheduledDate())
                .scheduledStart(request.getScheduledStart())
                .scheduledEnd(request.getScheduledEnd())
                .notes(request.getNotes())
                .aiGenerated(false)
                .completed(false)
                .build();
        PlannedTask saved = plannedTaskRepository.save(task);
        log.info("Created planned task {} for user {} on {} {}-{}", saved.getId(), userId,
                saved.getScheduledDate(), saved.getScheduledStart(), saved.getScheduledEnd());
        return saved;
    }

    public PlannedTask updateTask(String userId, String taskId, PlannedTaskUpdateRequest request) {
        PlannedTask task = getOwnedTask(userId, taskId);
        if (request.getCompleted() != null) {
            log.info("Marking planned task {} as {}", taskId, request.getCompleted() ? "completed" : "not completed");
            task.setCompleted(request.getCompleted());
        }
        if (request.getScheduledDate() != null) task.setScheduledDate(request.getScheduledDate());
        if (request.getScheduledStart() != null) task.setScheduledStart(request.getScheduledStart());
        if (request.getScheduledEnd() != null) task.setScheduledEnd(request.getScheduledEnd());
        if (request.getTitle() != null) task.setTitle(request.getTitle());
        if (request.getNotes() != null) task.setNotes(request.getNotes());
        requireValidRange(task.getScheduledStart(), task.getScheduledEnd());
        return plannedTaskRepository.save(task);
    }

    public void deleteTask(String userId, String taskId) {
        PlannedTask task = getOwnedTask(userId, taskId);
        log.warn("Deleting planned task {} for user {}", taskId, userId);
        plannedTaskRepository.delete(task);
    }

    private PlannedTask getOwnedTask(String userId, String taskId) {
        return plannedTaskRepository.findByIdAndUserId(taskId, userId)
                .orElseThrow(() -> new PlannedTaskNotFoundException("Planned task not found with ID: " + taskId));
    }

    private void requireValidRange(LocalTime start, LocalTime end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new InvalidRequestException("Task start must be before its end (got " + start + "-" + end + ")");
        }
    }
}
