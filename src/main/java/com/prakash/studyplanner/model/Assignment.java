package com.prakash.studyplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// Owned by the assignment service; this service only reads it.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "assignments")
public class Assignment {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String title;
    private String courseId;
    private String courseName; // Denormalized by the assignment service for display
    private LocalDateTime dueDate;
    private AssignmentPriority priority;
    private AssignmentStatus status;
    private Integer estimatedDurationMinutes;
}
