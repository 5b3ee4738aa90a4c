package com.prakash.studyplanner.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplaceScheduleRequest {

    @NotNull(message = "blocks array is required.")
    private List<@Valid AvailabilityBlockRequest> blocks;
}
