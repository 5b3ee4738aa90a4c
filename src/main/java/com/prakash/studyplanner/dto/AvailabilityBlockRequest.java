package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.BlockType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityBlockRequest {

    @NotNull(message = "dayOfWeek is required.")
    @Min(value = 0, message = "dayOfWeek must be between 0 (Sunday) and 6 (Saturday).")
    @Max(value = 6, message = "dayOfWeek must be between 0 (Sunday) and 6 (Saturday).")
    private Integer dayOfWeek;

    @NotNull(message = "start is required.")
    private LocalTime start;

    @NotNull(message = "end is required.")
    private LocalTime end;

    private BlockType blockType; // Defaults to STUDY

    @Size(max = 100, message = "label cannot exceed 100 characters.")
    private String label;

    @Size(max = 100, message = "location cannot exceed 100 characters.")
    private String location;
}
