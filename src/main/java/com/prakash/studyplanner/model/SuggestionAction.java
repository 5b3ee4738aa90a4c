package com.prakash.studyplanner.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Actions a user can apply to pending suggestions. Wire names are the ones the client sends.
 */
public enum SuggestionAction {
    ACCEPT("accept", false),
    DISMISS("dismiss", false),
    ACCEPT_ALL("acceptAll", true),
    DISMISS_ALL("dismissAll", true);

    private final String wireName;
    private final boolean bulk;

    SuggestionAction(String wireName, boolean bulk) {
        this.wireName = wireName;
        this.bulk = bulk;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isBulk() {
        return bulk;
    }

    public static Optional<SuggestionAction> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(action -> action.wireName.equals(name))
                .findFirst();
    }
}
