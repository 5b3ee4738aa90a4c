package com.prakash.studyplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveSuggestionResponse {

    private boolean success;
    private String action;
    private long affected; // Suggestions this call moved out of PENDING
}
