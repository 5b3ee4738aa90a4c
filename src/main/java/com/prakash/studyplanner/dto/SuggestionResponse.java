package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
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
public class SuggestionResponse {

    private String id;
    private String assignmentId;
    private LocalDate suggestedDate;
    private LocalTime suggestedStart;
    private LocalTime suggestedEnd;
    private String reason;
    private SuggestionStatus status;
    private LocalDateTime createdAt;
    private AssignmentSummary assignment; // null when the assignment no longer exists

    public static SuggestionResponse fromEntity(ScheduleSuggestion suggestion, Assignment assignment) {
        if (suggestion == null) {
            return null;
        }
        return SuggestionResponse.builder()
                .id(suggestion.getId())
                .assignmentId(suggestion.getAssignmentId())
                .suggestedDate(suggestion.getSuggestedDate())
                .suggestedStart(suggestion.getSuggestedStart())
                .suggestedEnd(suggestion.getSuggestedEnd())
                .reason(suggestion.getReason())
                .status(suggestion.getStatus())
                .createdAt(suggestion.getCreatedAt())
                .assignment(AssignmentSummary.fromEntity(assignment))
                .build();
    }
}
