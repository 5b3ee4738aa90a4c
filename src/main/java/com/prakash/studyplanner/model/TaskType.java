package com.prakash.studyplanner.model;

public enum TaskType {
    ASSIGNMENT, // Working on an assignment (default, and always used for accepted suggestions)
    STUDY,
    REVIEW,
    BREAK
}
