package com.prakash.studyplanner.repository;

import com.prakash.studyplanner.model.SuggestionStatus;

import java.util.Collection;

/**
 * Status transitions that must be decided by the database rather than by a read followed by a
 * write. Every update is conditional on the current status, so two racing callers can never
 * both move the same suggestion.
 */
public interface ScheduleSuggestionRepositoryCustom {

    /**
     * Moves one suggestion of the user from {@code from} to {@code to} and stamps it with the token.
     *
     * @return true if this call performed the transition, false if the suggestion was no longer in {@code from}.
     */
    boolean transition(String suggestionId, String userId, SuggestionStatus from, SuggestionStatus to, String resolutionToken);

    /**
     * Moves every suggestion of the user currently in {@code from} to {@code to} in a single update.
     *
     * @return the number of suggestions this call transitioned.
     */
    long transitionAll(String userId, SuggestionStatus from, SuggestionStatus to, String resolutionToken);

    /**
     * Puts suggestions claimed under the token back to PENDING and clears the claim. Used when the
     * ledger write that should follow a claim fails.
     *
     * @return the number of suggestions released.
     */
    long releaseClaim(String resolutionToken);

    /**
     * Deletes every PENDING suggestion of the user except those whose id is in {@code keepIds}.
     * Accepted and dismissed suggestions are never touched.
     *
     * @return the number of suggestions deleted.
     */
    long retireStalePending(String userId, Collection<String> keepIds);
}
