package com.prakash.studyplanner.model;

public enum SuggestionStatus {
    PENDING,   // Generated, waiting for the user to accept or dismiss
    ACCEPTED,  // Converted into a planned task
    DISMISSED; // Rejected by the user, no planned task

    public boolean isTerminal() {
        return this != PENDING;
    }
}
