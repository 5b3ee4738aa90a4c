package com.prakash.studyplanner.service;

import com.prakash.studyplanner.config.SchedulingConfig;
import com.prakash.studyplanner.dto.GenerateSuggestionsResponse;
import com.prakash.studyplanner.dto.SuggestionResponse;
import com.prakash.studyplanner.exception.NeedsSetupException;
import com.prakash.studyplanner.exception.SchedulePersistenceException;
import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.AssignmentStatus;
import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
import com.prakash.studyplanner.repository.AssignmentRepository;
import com.prakash.studyplanner.repository.AvailabilityBlockRepository;
import com.prakash.studyplanner.repository.PlannedTaskRepository;
import com.prakash.studyplanner.repository.ScheduleSuggestionRepository;
import com.prakash.studyplanner.service.agent.StudyInsightAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SuggestionGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionGenerationService.class);

    static final String INSIGHTS_FALLBACK = "Unable to generate study insights at this time. Please try again.";
    static final String NO_ASSIGNMENTS_MESSAGE = "No pending assignments to schedule";

    static final Comparator<ScheduleSuggestion> CHRONOLOGICAL = Comparator
            .comparing(ScheduleSuggestion::getSuggestedDate)
            .thenComparing(ScheduleSuggestion::getSuggestedStart);

    private final AvailabilityBlockRepository availabilityBlockRepository;
    private final AssignmentRepository assignmentRepository;
    private final PlannedTaskRepository plannedTaskRepository;
    private final ScheduleSuggestionRepository suggestionRepository;
    private final SuggestionPlanner suggestionPlanner;
    private final StudyInsightAgent studyInsightAgent;
    private final SchedulingConfig schedulingConfig;
    private final Clock clock;

    @Autowired
    public SuggestionGenerationService(AvailabilityBlockRepository availabilityBlockRepository,
                                       AssignmentRepository assignmentRepository,
                                       PlannedTaskRepository plannedTaskRepository,
                                       ScheduleSuggestionRepository suggestionRepository,
                                       SuggestionPlanner suggestionPlanner,
                                       StudyInsightAgent studyInsightAgent,
                                       SchedulingConfig schedulingConfig,
                                       Clock clock) {
        this.availabilityBlockRepository = availabilityBlockRepository;
        this.assignmentRepository = assignmentRepository;
        this.plannedTaskRepository = plannedTaskRepository;
        this.suggestionRepository = suggestionRepository;
        this.suggestionPlanner = suggestionPlanner;
        this.studyInsightAgent = studyInsightAgent;
        this.schedulingConfig = schedulingConfig;
        this.clock = clock;
    }

    /**
     * Proposes study sessions for the user's open assignments and stores them as PENDING.
     * Re-running without any change in between stores nothing new: a proposal that matches an
     * existing pending suggestion is answered with that suggestion instead. Pending suggestions
     * the run does not offer again are deleted, so the pending set is always this run's plan.
     *
     * @param userId The requesting user.
     * @return The proposals of this run (new and already pending), plus optional insights.
     * @throws NeedsSetupException if the user has no availability blocks.
     * @throws SchedulePersistenceException if reading or writing the stores fails.
     */
    public GenerateSuggestionsResponse generate(String userId) {
        log.info("Generating schedule suggestions for user {}", userId);
        try {
            List<AvailabilityBlock> blocks = availabilityBlockRepository.findByUserId(userId);
            if (blocks.isEmpty()) {
                log.info("User {} has no availability blocks configured. Setup required.", userId);
                throw new NeedsSetupException("Please set up your weekly schedule first");
            }

            List<Assignment> assignments = assignmentRepository.findByUserIdAndStatusNot(userId, AssignmentStatus.COMPLETED);
            if (assignments.isEmpty()) {
                log.info("User {} has no pending assignments. Nothing to schedule.", userId);
                return GenerateSuggestionsResponse.builder()
                        .suggestions(List.of())
                        .insights("")
                        .message(NO_ASSIGNMENTS_MESSAGE)
                        .build();
            }

            LocalDateTime now = LocalDateTime.now(clock);
            LocalDate today = now.toLocalDate();
            LocalDate horizon = today.plusDays(Math.max(schedulingConfig.getLookAheadDays(), 1) - 1L);
            List<PlannedTask> existingTasks = plannedTaskRepository.findByUserIdAndScheduledDateWithin(userId, today, horizon);
            log.debug("Loaded {} blocks, {} open assignments and {} planned tasks for user {}",
                    blocks.size(), assignments.size(), existingTasks.size(), userId);

            List<ScheduleSuggestion> candidates = suggestionPlanner.plan(userId, blocks, assignments, existingTasks, now);
            List<ScheduleSuggestion> pending = suggestionRepository.findByUserIdAndStatus(userId, SuggestionStatus.PENDING);

            List<ScheduleSuggestion> result = new ArrayList<>();
            List<ScheduleSuggestion> fresh = new ArrayList<>();
            for (ScheduleSuggestion candidate : candidates) {
                Optional<ScheduleSuggestion> duplicate = pending.stream().filter(candidate::sameSlotAs).findFirst();
                if (duplicate.isPresent()) {
                    log.debug("Candidate for assignment {} on {} {} is already pending as {}. Not stored again.",
                            candidate.getAssignmentId(), candidate.getSuggestedDate(), candidate.getSuggestedStart(), duplicate.get().getId());
                    result.add(duplicate.get());
                } else {
                    fresh.add(candidate);
                }
            }

            // Anything still pending that this run did not offer again is superseded
            Set<String> keepIds = result.stream().map(ScheduleSuggestion::getId).collect(Collectors.toSet());
            long retired = suggestionRepository.retireStalePending(userId, keepIds);
            if (retired > 0) {
                log.info("Retired {} superseded pending suggestions for user {}", retired, userId);
            }

            if (!fresh.isEmpty()) {
                result.addAll(persistFresh(userId, fresh));
            }
            result.sort(CHRONOLOGICAL);
            log.info("Generated {} suggestions for user {} ({} new, {} already pending, {} assignments unplaced)",
                    result.size(), userId, fresh.size(), result.size() - fresh.size(), assignments.size() - candidates.size());

            Map<String, Assignment> assignmentsById = assignments.stream()
                    .collect(Collectors.toMap(Assignment::getId, Function.identity(), (first, second) -> first));
            List<Assignment> ranked = assignments.stream().sorted(SuggestionPlanner.URGENCY_ORDER).collect(Collectors.toList());

            return GenerateSuggestionsResponse.builder()
                    .suggestions(result.stream()
                            .map(s -> SuggestionResponse.fromEntity(s, assignmentsById.get(s.getAssignmentId())))
                            .collect(Collectors.toList()))
                    .insights(insightsFor(ranked, result, today))
                    .message(result.isEmpty() ? "No open time in your schedule fits your pending assignments" : null)
                    .build();
        } catch (DataAccessException e) {
            log.error("Storage failure while generating suggestions for user {}: {}", userId, e.getMessage(), e);
            throw new SchedulePersistenceException("Failed to generate schedule suggestions", e);
        }
    }

    /**
     * Pending suggestions of the user in date/time order, joined with their assignments for display.
     */
    public List<SuggestionResponse> listPending(String userId) {
        log.debug("Fetching pending suggestions for user {}", userId);
        try {
            List<ScheduleSuggestion> pending = suggestionRepository.findByUserIdAndStatus(userId, SuggestionStatus.PENDING);
            List<String> assignmentIds = pending.stream()
                    .map(ScheduleSuggestion::getAssignmentId)
                    .distinct()
                    .collect(Collectors.toList());
            Map<String, Assignment> assignmentsById = new HashMap<>();
            for (Assignment assignment : assignmentRepository.findAllById(assignmentIds)) {
                if (userId.equals(assignment.getUserId())) {
                    assignmentsById.put(assignment.getId(), assignment);
                }
            }
            return pending.stream()
                    .sorted(CHRONOLOGICAL)
                    .map(s -> SuggestionResponse.fromEntity(s, assignmentsById.get(s.getAssignmentId())))
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            log.error("Storage failure while listing suggestions for user {}: {}", userId, e.getMessage(), e);
            throw new SchedulePersistenceException("Failed to fetch suggestions", e);
        }
    }

    /**
     * Inserts the new candidates. A candidate rejected by the pending-slot index was stored by a
     * concurrent run; the stored record is returned in its place.
     */
    private List<ScheduleSuggestion> persistFresh(String userId, List<ScheduleSuggestion> fresh) {
        try {
            return suggestionRepository.saveAll(fresh);
        } catch (DuplicateKeyException e) {
            log.info("A concurrent run already stored some suggestions for user {}. Inserting one by one.", userId);
        }
        List<ScheduleSuggestion> stored = new ArrayList<>();
        for (ScheduleSuggestion candidate : fresh) {
            try {
                stored.add(suggestionRepository.save(candidate));
            } catch (DuplicateKeyException duplicate) {
                Optional<ScheduleSuggestion> twin = suggestionRepository.findByUserIdAndStatus(userId, SuggestionStatus.PENDING)
                        .stream()
                        .filter(candidate::sameSlotAs)
                        .findFirst();
                if (twin.isPresent()) {
                    stored.add(twin.get());
                } else {
                    log.warn("Suggestion for assignment {} on {} {} was rejected as duplicate but is no longer pending",
                            candidate.getAssignmentId(), candidate.getSuggestedDate(), candidate.getSuggestedStart());
                }
            }
        }
        return stored;
    }

    private String insightsFor(List<Assignment> ranked, List<ScheduleSuggestion> sessions, LocalDate today) {
        if (!schedulingConfig.isInsightsEnabled()) {
            return "";
        }
        try {
            return studyInsightAgent.generateInsights(ranked, sessions, today);
        } catch (RuntimeException e) {
            // The suggestions are already stored; insights are optional
            log.warn("Study insights unavailable: {}", e.getMessage());
            return INSIGHTS_FALLBACK;
        }
    }
}
