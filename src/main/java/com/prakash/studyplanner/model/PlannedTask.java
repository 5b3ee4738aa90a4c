package com.prakash.studyplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A concrete, dated work session on the user's calendar. Either created by hand or materialized
 * from an accepted {@link ScheduleSuggestion}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "planned_tasks")
public class PlannedTask {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String assignmentId; // null for free-form tasks
    private String title;

    @Builder.Default
    private TaskType taskType = TaskType.ASSIGNMENT;

    private LocalDate scheduledDate;
    private LocalTime scheduledStart;
    private LocalTime scheduledEnd;

    private boolean completed;
    private boolean aiGenerated;
    private String notes;

    // Set only for tasks created from a suggestion; one suggestion never yields two tasks
    @Indexed(unique = true, sparse = true)
    private String sourceSuggestionId;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    public static PlannedTask fromSuggestion(ScheduleSuggestion suggestion) {
        return PlannedTask.builder()
                .userId(suggestion.getUserId())
                .assignmentId(suggestion.getAssignmentId())
                .taskType(TaskType.ASSIGNMENT)
                .scheduledDate(suggestion.getSuggestedDate())
                .scheduledStart(suggestion.getSuggestedStart())
                .scheduledEnd(suggestion.getSuggestedEnd())
                .notes(suggestion.getReason())
                .aiGenerated(true)
                .completed(false)
                .sourceSuggestionId(suggestion.getId())
                .build();
    }
}
