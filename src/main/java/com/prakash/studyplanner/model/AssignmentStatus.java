package com.prakash.studyplanner.model;

public enum AssignmentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
