package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.AssignmentPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

// Display data joined onto a suggestion; never stored with it
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssignmentSummary {

    private String id;
    private String title;
    private AssignmentPriority priority;
    private String courseName;
    private LocalDateTime dueDate;

    public static AssignmentSummary fromEntity(Assignment assignment) {
        if (assignment == null) {
            return null;
        }
        return AssignmentSummary.builder()
                .id(assignment.getId())
                .title(assignment.getTitle())
                .priority(assignment.getPriority())
                .courseName(assignment.getCourseName())
                .dueDate(assignment.getDueDate())
                .build();
    }
}
