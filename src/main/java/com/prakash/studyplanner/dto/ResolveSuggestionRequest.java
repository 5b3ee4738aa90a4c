package com.prakash.studyplanner.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveSuggestionRequest {

    // Required for accept/dismiss; bulk actions ignore it (clients send "bulk")
    private String suggestionId;

    @NotBlank(message = "action is required.")
    private String action;
}
