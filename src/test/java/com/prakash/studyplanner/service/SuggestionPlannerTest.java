package com.prakash.studyplanner.service;

import com.prakash.studyplanner.config.SchedulingConfig;
import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.AssignmentPriority;
import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.model.BlockType;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionPlannerTest {

    // Monday
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 9, 0);
    private static final LocalDate TUESDAY = LocalDate.of(2026, 10, 20);
    private static final int SUNDAY_BASED_TUESDAY = 2;

    private SchedulingConfig config;
    private SuggestionPlanner planner;

    @BeforeEach
    void setUp() {
        config = new SchedulingConfig();
        planner = new SuggestionPlanner(config);
    }

    @Test
    void placesEssayAtStartOfUpcomingTuesdayBlock() {
        AvailabilityBlock library = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        library.setLabel("Library block");
        library.setLocation("Main library");
        Assignment essay = assignment("a-1", "Essay", 90, LocalDateTime.of(2026, 10, 23, 23, 59), AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(library), List.of(essay), List.of(), NOW);

        assertThat(result).hasSize(1);
        ScheduleSuggestion suggestion = result.get(0);
        assertThat(suggestion.getUserId()).isEqualTo("user-1");
        assertThat(suggestion.getAssignmentId()).isEqualTo("a-1");
        assertThat(suggestion.getSuggestedDate()).isEqualTo(TUESDAY);
        assertThat(suggestion.getSuggestedStart()).isEqualTo(LocalTime.of(15, 0));
        assertThat(suggestion.getSuggestedEnd()).isEqualTo(LocalTime.of(16, 30));
        assertThat(suggestion.getStatus()).isEqualTo(SuggestionStatus.PENDING);
        assertThat(suggestion.getReason())
                .contains("Tuesday")
                .contains("Library block")
                .contains("15:00-17:00")
                .contains("at Main library")
                .contains("3 days before the deadline");
    }

    @Test
    void earlierDueDateIsPlacedFirst() {
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        Assignment dueThursday = assignment("a-thu", "Lab report", 60, LocalDateTime.of(2026, 10, 22, 12, 0), AssignmentPriority.HIGH);
        Assignment dueWednesday = assignment("a-wed", "Problem set", 60, LocalDateTime.of(2026, 10, 21, 12, 0), AssignmentPriority.LOW);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(dueThursday, dueWednesday), List.of(), NOW);

        assertThat(result).extracting(ScheduleSuggestion::getAssignmentId).containsExactly("a-wed", "a-thu");
        assertThat(result.get(0).getSuggestedStart()).isEqualTo(LocalTime.of(15, 0));
        assertThat(result.get(1).getSuggestedStart()).isEqualTo(LocalTime.of(16, 0));
        assertThat(result.get(1).getReason()).endsWith("Marked high priority.");
    }

    @Test
    void sameDueDateFallsBackToPriorityThenDuration() {
        LocalDateTime due = LocalDateTime.of(2026, 10, 23, 17, 0);
        Assignment low = assignment("a-low", "Reading", 30, due, AssignmentPriority.LOW);
        Assignment highShort = assignment("a-high-short", "Quiz prep", 30, due, AssignmentPriority.HIGH);
        Assignment highLong = assignment("a-high-long", "Project", 90, due, AssignmentPriority.HIGH);
        Assignment undated = assignment("a-none", "Side project", 30, null, AssignmentPriority.HIGH);

        List<Assignment> ranked = List.of(low, undated, highShort, highLong).stream()
                .sorted(SuggestionPlanner.URGENCY_ORDER)
                .collect(Collectors.toList());

        assertThat(ranked).extracting(Assignment::getId)
                .containsExactly("a-high-long", "a-high-short", "a-low", "a-none");
    }

    @Test
    void neverOverlapsExistingPlannedTasks() {
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        PlannedTask existing = PlannedTask.builder()
                .id("t-1")
                .userId("user-1")
                .scheduledDate(TUESDAY)
                .scheduledStart(LocalTime.of(15, 0))
                .scheduledEnd(LocalTime.of(16, 0))
                .build();
        Assignment essay = assignment("a-1", "Essay", 60, LocalDateTime.of(2026, 10, 23, 23, 59), AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(essay), List.of(existing), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(TUESDAY);
        assertThat(result.get(0).getSuggestedStart()).isEqualTo(LocalTime.of(16, 0));
        assertThat(result.get(0).getSuggestedEnd()).isEqualTo(LocalTime.of(17, 0));
    }

    @Test
    void sessionsOfOneRunNeverOverlapEachOther() {
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        LocalDateTime due = LocalDateTime.of(2026, 10, 30, 12, 0);
        Assignment first = assignment("a-1", "Essay", 90, due, AssignmentPriority.MEDIUM);
        Assignment second = assignment("a-2", "Slides", 60, due, AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(first, second), List.of(), NOW);

        assertThat(result).hasSize(2);
        // 60 minutes no longer fit after the 90-minute essay, so the next Tuesday is used
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(TUESDAY);
        assertThat(result.get(1).getSuggestedDate()).isEqualTo(TUESDAY.plusWeeks(1));
        assertThat(result.get(1).getSuggestedStart()).isEqualTo(LocalTime.of(15, 0));
    }

    @Test
    void mergesOverlappingAndTouchingBlocks() {
        List<AvailabilityBlock> blocks = List.of(
                block(SUNDAY_BASED_TUESDAY, "15:00", "16:00", BlockType.STUDY),
                block(SUNDAY_BASED_TUESDAY, "15:30", "16:30", BlockType.FREE),
                block(SUNDAY_BASED_TUESDAY, "16:30", "17:00", BlockType.STUDY));
        Assignment project = assignment("a-1", "Project", 120, LocalDateTime.of(2026, 10, 23, 23, 59), AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", blocks, List.of(project), List.of(), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(TUESDAY);
        assertThat(result.get(0).getSuggestedStart()).isEqualTo(LocalTime.of(15, 0));
        assertThat(result.get(0).getSuggestedEnd()).isEqualTo(LocalTime.of(17, 0));
    }

    @Test
    void fallsBackToEarliestSlotAfterDeadlineWhenNothingFitsBefore() {
        AvailabilityBlock thursday = block(4, "10:00", "12:00", BlockType.STUDY);
        Assignment lateWork = assignment("a-1", "Worksheet", 60, LocalDateTime.of(2026, 10, 21, 23, 59), AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(thursday), List.of(lateWork), List.of(), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(LocalDate.of(2026, 10, 22));
        assertThat(result.get(0).getSuggestedStart()).isEqualTo(LocalTime.of(10, 0));
        assertThat(result.get(0).getReason()).startsWith("No open slot fits before the");
    }

    @Test
    void ignoresBlocksThatAreNotEligible() {
        AvailabilityBlock lecture = block(SUNDAY_BASED_TUESDAY, "09:00", "12:00", BlockType.CLASS);
        AvailabilityBlock shift = block(3, "13:00", "18:00", BlockType.WORK);
        Assignment essay = assignment("a-1", "Essay", 60, null, AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(lecture, shift), List.of(essay), List.of(), NOW);

        assertThat(result).isEmpty();
    }

    @Test
    void omitsAssignmentsThatFitNowhere() {
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        Assignment tooLong = assignment("a-long", "Thesis chapter", 180, LocalDateTime.of(2026, 10, 23, 23, 59), AssignmentPriority.HIGH);
        Assignment fits = assignment("a-fits", "Reading", 45, LocalDateTime.of(2026, 10, 24, 23, 59), AssignmentPriority.LOW);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(tooLong, fits), List.of(), NOW);

        assertThat(result).extracting(ScheduleSuggestion::getAssignmentId).containsExactly("a-fits");
    }

    @Test
    void todayStartsNoEarlierThanNowRoundedUpToTheMinute() {
        AvailabilityBlock monday = block(1, "14:00", "16:00", BlockType.STUDY);
        Assignment essay = assignment("a-1", "Essay", 60, null, AssignmentPriority.MEDIUM);
        LocalDateTime afternoon = LocalDateTime.of(2026, 10, 19, 14, 20, 30);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(monday), List.of(essay), List.of(), afternoon);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(LocalDate.of(2026, 10, 19));
        assertThat(result.get(0).getSuggestedStart()).isEqualTo(LocalTime.of(14, 21));
        assertThat(result.get(0).getSuggestedEnd()).isEqualTo(LocalTime.of(15, 21));
    }

    @Test
    void todaysBlockThatAlreadyEndedMovesToNextWeek() {
        AvailabilityBlock monday = block(1, "07:00", "08:00", BlockType.STUDY);
        Assignment essay = assignment("a-1", "Essay", 60, null, AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(monday), List.of(essay), List.of(), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedDate()).isEqualTo(LocalDate.of(2026, 10, 26));
    }

    @Test
    void missingEstimateUsesDefaultDurationAndUndatedReason() {
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        Assignment unestimated = assignment("a-1", "Review notes", null, null, AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(unestimated), List.of(), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getSuggestedEnd()).isEqualTo(LocalTime.of(16, 0));
        assertThat(result.get(0).getReason()).startsWith("No due date, so this takes the earliest open time in your Tuesday study block");
    }

    @Test
    void doesNotLookBeyondConfiguredWindow() {
        config.setLookAheadDays(1);
        AvailabilityBlock tuesday = block(SUNDAY_BASED_TUESDAY, "15:00", "17:00", BlockType.STUDY);
        Assignment essay = assignment("a-1", "Essay", 60, null, AssignmentPriority.MEDIUM);

        List<ScheduleSuggestion> result = planner.plan("user-1", List.of(tuesday), List.of(essay), List.of(), NOW);

        assertThat(result).isEmpty();
    }

    private static AvailabilityBlock block(int dayOfWeek, String start, String end, BlockType type) {
        return AvailabilityBlock.builder()
                .userId("user-1")
                .dayOfWeek(dayOfWeek)
                .start(LocalTime.parse(start))
                .end(LocalTime.parse(end))
                .blockType(type)
                .build();
    }

    private static Assignment assignment(String id, String title, Integer minutes, LocalDateTime due, AssignmentPriority priority) {
        return Assignment.builder()
                .id(id)
                .userId("user-1")
                .title(title)
                .estimatedDurationMinutes(minutes)
                .dueDate(due)
                .priority(priority)
                .build();
    }
}
