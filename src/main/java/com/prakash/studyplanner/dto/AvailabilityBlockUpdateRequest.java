package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.BlockType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

// Partial update: null fields are left unchanged
@Data
@NoArgsConstructor
public class AvailabilityBlockUpdateRequest {

    @Min(value = 0, message = "dayOfWeek must be between 0 (Sunday) and 6 (Saturday).")
    @Max(value = 6, message = "dayOfWeek must be between 0 (Sunday) and 6 (Saturday).")
    private Integer dayOfWeek;

    private LocalTime start;
    private LocalTime end;
    private BlockType blockType;
    private String label;
    private String location;
}
