package com.prakash.studyplanner.service;

import com.prakash.studyplanner.dto.ResolveSuggestionRequest;
import com.prakash.studyplanner.dto.ResolveSuggestionResponse;
import com.prakash.studyplanner.exception.InvalidRequestException;
import com.prakash.studyplanner.exception.SchedulePersistenceException;
import com.prakash.studyplanner.exception.SuggestionNotFoundException;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionAction;
import com.prakash.studyplanner.model.SuggestionStatus;
import com.prakash.studyplanner.repository.PlannedTaskRepository;
import com.prakash.studyplanner.repository.ScheduleSuggestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Moves suggestions out of PENDING and writes the planned tasks accepted suggestions turn into.
 * <p>
 * Every transition is a conditional update on {@code status = PENDING}; whichever call wins it
 * writes the ledger, every other call sees the suggestion as already handled. A claim whose ledger
 * write fails is released so the suggestion is PENDING again and can be retried.
 */
@Service
public class SuggestionResolutionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionResolutionService.class);

    private final ScheduleSuggestionRepository suggestionRepository;
    private final PlannedTaskRepository plannedTaskRepository;
    private final Clock clock;

    @Autowired
    public SuggestionResolutionService(ScheduleSuggestionRepository suggestionRepository,
                                       PlannedTaskRepository plannedTaskRepository,
                                       Clock clock) {
        this.suggestionRepository = suggestionRepository;
        this.plannedTaskRepository = plannedTaskRepository;
        this.clock = clock;
    }

    /**
     * Validates the request shape and dispatches to the matching action.
     *
     * @throws InvalidRequestException if the action is unknown or a single action has no suggestion id.
     */
    public ResolveSuggestionResponse resolve(String userId, ResolveSuggestionRequest request) {
        SuggestionAction action = SuggestionAction.fromWireName(request.getAction())
                .orElseThrow(() -> {
                    log.warn("Rejected resolve request from user {} with unknown action '{}'", userId, request.getAction());
                    return new InvalidRequestException("Invalid action: " + request.getAction());
                });
        if (!action.isBulk() && (request.getSuggestionId() == null || request.getSuggestionId().isBlank())) {
            throw new InvalidRequestException("suggestionId is required for action " + action.getWireName());
        }

        long affected;
        switch (action) {
            case ACCEPT:
                affected = accept(userId, request.getSuggestionId()) ? 1 : 0;
                break;
            case DISMISS:
                affected = dismiss(userId, request.getSuggestionId()) ? 1 : 0;
                break;
            case ACCEPT_ALL:
                affected = acceptAll(userId);
                break;
            case DISMISS_ALL:
                affected = dismissAll(userId);
                break;
            default:
                throw new InvalidRequestException("Invalid action: " + request.getAction());
        }
        return new ResolveSuggestionResponse(true, action.getWireName(), affected);
    }

    /**
     * Accepts one suggestion and creates its planned task.
     *
     * @return true if this call accepted it, false if it was already accepted or dismissed.
     * @throws SuggestionNotFoundException if the suggestion does not exist or belongs to another user.
     * @throws SchedulePersistenceException if the planned task could not be written; the suggestion stays PENDING.
     */
    public boolean accept(String userId, String suggestionId) {
        log.info("User {} accepting suggestion {}", userId, suggestionId);
        ScheduleSuggestion suggestion = getOwnedSuggestion(userId, suggestionId);
        if (suggestion.getStatus().isTerminal()) {
            log.info("Suggestion {} is already {}. Nothing to do.", suggestionId, suggestion.getStatus());
            return false;
        }

        String token = newToken();
        if (!claim(suggestionId, userId, SuggestionStatus.ACCEPTED, token)) {
            log.info("Suggestion {} was resolved by a concurrent request. Nothing to do.", suggestionId);
            return false;
        }

        try {
            PlannedTask task = plannedTaskRepository.save(PlannedTask.fromSuggestion(suggestion));
            log.info("Suggestion {} accepted as planned task {} on {} {}-{}", suggestionId, task.getId(),
                    task.getScheduledDate(), task.getScheduledStart(), task.getScheduledEnd());
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to create planned task for suggestion {}: {}", suggestionId, e.getMessage(), e);
            releaseQuietly(token);
            throw new SchedulePersistenceException("Failed to create task", e);
        }
    }

    /**
     * @return true if this call dismissed it, false if it was already accepted or dismissed.
     * @throws SuggestionNotFoundException if the suggestion does not exist or belongs to another user.
     */
    public boolean dismiss(String userId, String suggestionId) {
        log.info("User {} dismissing suggestion {}", userId, suggestionId);
        ScheduleSuggestion suggestion = getOwnedSuggestion(userId, suggestionId);
        if (suggestion.getStatus().isTerminal()) {
            log.info("Suggestion {} is already {}. Nothing to do.", suggestionId, suggestion.getStatus());
            return false;
        }
        return claim(suggestionId, userId, SuggestionStatus.DISMISSED, newToken());
    }

    /**
     * Accepts every suggestion that is PENDING at the moment of the call and creates their
     * planned tasks in one batch.
     *
     * @return the number of suggestions accepted by this call.
     */
    public long acceptAll(String userId) {
        log.info("User {} accepting all pending suggestions", userId);
        String token = newToken();
        long claimed;
        try {
            claimed = suggestionRepository.transitionAll(userId, SuggestionStatus.PENDING, SuggestionStatus.ACCEPTED, token);
        } catch (DataAccessException e) {
            log.error("Failed to accept pending suggestions for user {}: {}", userId, e.getMessage(), e);
            throw new SchedulePersistenceException("Failed to accept suggestions", e);
        }
        if (claimed == 0) {
            log.info("No pending suggestions to accept for user {}", userId);
            return 0;
        }

        List<String> claimedIds = List.of();
        try {
            List<ScheduleSuggestion> snapshot = suggestionRepository.findByResolutionToken(token);
            claimedIds = snapshot.stream().map(ScheduleSuggestion::getId).collect(Collectors.toList());
            List<PlannedTask> tasks = snapshot.stream().map(PlannedTask::fromSuggestion).collect(Collectors.toList());
            plannedTaskRepository.saveAll(tasks);
            log.info("Accepted {} suggestions for user {} and created {} planned tasks", claimed, userId, tasks.size());
            return claimed;
        } catch (DataAccessException e) {
            log.error("Failed to create planned tasks for {} accepted suggestions of user {}: {}", claimed, userId, e.getMessage(), e);
            rollBackBulkAccept(token, claimedIds);
            throw new SchedulePersistenceException("Failed to create tasks", e);
        }
    }

    /**
     * @return the number of suggestions dismissed by this call.
     */
    public long dismissAll(String userId) {
        log.info("User {} dismissing all pending suggestions", userId);
        try {
            long dismissed = suggestionRepository.transitionAll(userId, SuggestionStatus.PENDING, SuggestionStatus.DISMISSED, newToken());
            log.info("Dismissed {} suggestions for user {}", dismissed, userId);
            return dismissed;
        } catch (DataAccessException e) {
            log.error("Failed to dismiss pending suggestions for user {}: {}", userId, e.getMessage(), e);
            throw new SchedulePersistenceException("Failed to dismiss suggestions", e);
        }
    }

    /**
     * Deletes accepted and dismissed suggestions resolved longer ago than the retention period.
     * Pending suggestions are never touched.
     */
    public long cleanupResolvedSuggestions(Duration retentionPeriod) {
        LocalDateTime cutoffTime = LocalDateTime.now(clock).minus(retentionPeriod);
        List<SuggestionStatus> terminalStatuses = List.of(SuggestionStatus.ACCEPTED, SuggestionStatus.DISMISSED);
        log.info("Starting cleanup of suggestions in terminal states ({}) resolved before {}", terminalStatuses, cutoffTime);
        List<ScheduleSuggestion> toDelete = suggestionRepository.findByStatusInAndResolvedAtBefore(terminalStatuses, cutoffTime);
        if (toDelete.isEmpty()) {
            log.info("No old suggestions found to cleanup.");
            return 0;
        }
        log.warn("Deleting {} suggestions resolved before {}", toDelete.size(), cutoffTime);
        suggestionRepository.deleteAll(toDelete);
        return toDelete.size();
    }

    private ScheduleSuggestion getOwnedSuggestion(String userId, String suggestionId) {
        try {
            return suggestionRepository.findByIdAndUserId(suggestionId, userId)
                    .orElseThrow(() -> new SuggestionNotFoundException("Suggestion not found"));
        } catch (DataAccessException e) {
            throw new SchedulePersistenceException("Failed to load suggestion " + suggestionId, e);
        }
    }

    private boolean claim(String suggestionId, String userId, SuggestionStatus target, String token) {
        try {
            return suggestionRepository.transition(suggestionId, userId, SuggestionStatus.PENDING, target, token);
        } catch (DataAccessException e) {
            log.error("Failed to mark suggestion {} as {}: {}", suggestionId, target, e.getMessage(), e);
            throw new SchedulePersistenceException("Failed to update suggestion", e);
        }
    }

    private void rollBackBulkAccept(String token, List<String> claimedIds) {
        if (!claimedIds.isEmpty()) {
            try {
                long removed = plannedTaskRepository.deleteBySourceSuggestionIdIn(claimedIds);
                log.warn("Removed {} planned tasks written before the batch failed", removed);
            } catch (DataAccessException e) {
                log.error("Could not remove partially written planned tasks for claim {}: {}", token, e.getMessage(), e);
            }
        }
        releaseQuietly(token);
    }

    // Only logged: the caller gets the failure that triggered the release.
    private void releaseQuietly(String token) {
        try {
            suggestionRepository.releaseClaim(token);
        } catch (DataAccessException e) {
            log.error("Could not release claim {}; its suggestions stay resolved without tasks: {}", token, e.getMessage(), e);
        }
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}
