package com.prakash.studyplanner.model;

public enum AssignmentPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    AssignmentPriority(int rank) {
        this.rank = rank;
    }

    /**
     * Higher rank means more urgent. A missing priority ranks like MEDIUM, the default
     * assignments are created with.
     */
    public static int rankOf(AssignmentPriority priority) {
        return priority != null ? priority.rank : MEDIUM.rank;
    }
}
