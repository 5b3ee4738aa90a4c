package com.prakash.studyplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GenerateSuggestionsResponse {

    private List<SuggestionResponse> suggestions;
    private String insights; // Free text from the chat model, may be empty
    private String message;
}
