package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlannedTaskResponse {

    private String id;
    private String assignmentId;
    private String title;
    private TaskType taskType;
    private LocalDate scheduledDate;
    private LocalTime scheduledStart;
    private LocalTime scheduledEnd;
    private boolean completed;
    private boolean aiGenerated;
    private String notes;
    private LocalDateTime createdAt;

    public static PlannedTaskResponse fromEntity(PlannedTask task) {
        if (task == null) {
            return null;
        }
        return PlannedTaskResponse.builder()
                .id(task.getId())
                .assignmentId(task.getAssignmentId())
                .title(task.getTitle())
                .taskType(task.getTaskType())
                .scheduledDate(task.getScheduledDate())
                .scheduledStart(task.getScheduledStart())
                .scheduledEnd(task.getScheduledEnd())
                .completed(task.isCompleted())
                .aiGenerated(task.isAiGenerated())
                .notes(task.getNotes())
                .createdAt(task.getCreatedAt())
                .build();
    }
}
