package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.TaskType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlannedTaskRequest {

    private String assignmentId; // Optional: free-form tasks have none

    @Size(max = 200, message = "title cannot exceed 200 characters.")
    private String title;

    private TaskType taskType;

    @NotNull(message = "scheduledDate is required.")
    private LocalDate scheduledDate;

    @NotNull(message = "scheduledStart is required.")
    private LocalTime scheduledStart;

    @NotNull(message = "scheduledEnd is required.")
    private LocalTime scheduledEnd;

    @Size(max = 2000, message = "notes cannot exceed 2000 characters.")
    private String notes;
}
