package com.prakash.studyplanner.model;

public enum BlockType {
    CLASS, // Lecture or lab, never used for study sessions
    STUDY, // Dedicated study time
    FREE,  // Unstructured free time
    WORK,  // Job shifts
    OTHER
}
