package com.prakash.studyplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

// Partial update: null fields are left unchanged
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlannedTaskUpdateRequest {

    private Boolean completed;
    private LocalDate scheduledDate;
    private LocalTime scheduledStart;
    private LocalTime scheduledEnd;
    private String title;
    private String notes;
}
