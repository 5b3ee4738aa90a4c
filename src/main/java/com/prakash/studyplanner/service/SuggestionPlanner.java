package com.prakash.studyplanner.service;

import com.prakash.studyplanner.config.SchedulingConfig;
import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.AssignmentPriority;
import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Greedy, urgency-first placement of study sessions into the user's weekly availability.
 * <p>
 * Pure computation: callers load the inputs and persist the output. Sessions produced by one
 * call never overlap each other or any of the supplied planned tasks.
 */
@Component
public class SuggestionPlanner {

    private static final Logger log = LoggerFactory.getLogger(SuggestionPlanner.class);
    private static final DateTimeFormatter DUE_FORMATTER = DateTimeFormatter.ofPattern("EEEE, MMM d", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * Due date ascending (undated last), then priority descending, then longer jobs first.
     * Title and id only make the order deterministic.
     */
    static final Comparator<Assignment> URGENCY_ORDER = Comparator
            .comparing(Assignment::getDueDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(a -> AssignmentPriority.rankOf(a.getPriority()), Comparator.reverseOrder())
            .thenComparing(a -> a.getEstimatedDurationMinutes() != null ? a.getEstimatedDurationMinutes() : 0, Comparator.reverseOrder())
            .thenComparing(Assignment::getTitle, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Assignment::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SchedulingConfig config;

    @Autowired
    public SuggestionPlanner(SchedulingConfig config) {
        this.config = config;
    }

    /**
     * Proposes at most one session per assignment.
     *
     * @param userId        Owner of the proposals.
     * @param blocks        The user's weekly availability; only eligible block types are used.
     * @param assignments   Open assignments to place.
     * @param existingTasks Planned tasks already on the calendar; their time is never reused.
     * @param now           Current local date-time. The window starts today, and no session starts before now.
     * @return Unsaved PENDING suggestions in placement (urgency) order. Assignments that fit nowhere are left out.
     */
    public List<ScheduleSuggestion> plan(String userId,
                                         List<AvailabilityBlock> blocks,
                                         List<Assignment> assignments,
                                         List<PlannedTask> existingTasks,
                                         LocalDateTime now) {
        List<OpenSegment> segments = expandAvailability(blocks, now);
        Map<LocalDate, List<TimeRange>> busy = collectBusyTime(existingTasks);

        List<Assignment> ranked = assignments.stream().sorted(URGENCY_ORDER).collect(Collectors.toList());
        log.debug("Placing {} assignments into {} open segments for user {}", ranked.size(), segments.size(), userId);

        List<ScheduleSuggestion> suggestions = new ArrayList<>();
        for (Assignment assignment : ranked) {
            int duration = durationOf(assignment);
            Optional<FreePiece> onTime = findEarliest(segments, busy, duration, assignment.getDueDate());
            Optional<FreePiece> chosen = onTime.isPresent() ? onTime : findEarliest(segments, busy, duration, null);
            if (chosen.isEmpty()) {
                log.debug("No open slot of {} minutes for assignment {} ({}). Skipping.", duration, assignment.getId(), assignment.getTitle());
                continue;
            }

            FreePiece piece = chosen.get();
            LocalTime start = piece.range.start;
            LocalTime end = start.plusMinutes(duration);
            busy.computeIfAbsent(piece.date, d -> new ArrayList<>()).add(new TimeRange(start, end));

            suggestions.add(ScheduleSuggestion.builder()
                    .userId(userId)
                    .assignmentId(assignment.getId())
                    .suggestedDate(piece.date)
                    .suggestedStart(start)
                    .suggestedEnd(end)
                    .reason(buildReason(assignment, piece, start, onTime.isPresent()))
                    .status(SuggestionStatus.PENDING)
                    .build());
            log.debug("Placed assignment {} on {} {}-{}", assignment.getId(), piece.date, start, end);
        }
        return suggestions;
    }

    private int durationOf(Assignment assignment) {
        Integer estimate = assignment.getEstimatedDurationMinutes();
        return estimate != null && estimate > 0 ? estimate : config.getDefaultDurationMinutes();
    }

    /**
     * Expands eligible blocks over the look-ahead window. Overlapping or touching blocks on the same
     * date are merged so the union of the user's availability is usable.
     */
    private List<OpenSegment> expandAvailability(List<AvailabilityBlock> blocks, LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        LocalTime earliestToday = ceilToMinute(now.toLocalTime());
        List<OpenSegment> segments = new ArrayList<>();

        for (int offset = 0; offset < config.getLookAheadDays(); offset++) {
            LocalDate date = today.plusDays(offset);
            List<AvailabilityBlock> dayBlocks = blocks.stream()
                    .filter(block -> config.getEligibleBlockTypes().contains(block.getBlockType()))
                    .filter(block -> block.fallsOn(date.getDayOfWeek()))
                    .filter(block -> block.getStart() != null && block.getEnd() != null && block.getStart().isBefore(block.getEnd()))
                    .sorted(Comparator.comparing(AvailabilityBlock::getStart))
                    .collect(Collectors.toList());

            OpenSegment current = null;
            for (AvailabilityBlock block : dayBlocks) {
                LocalTime start = block.getStart();
                if (offset == 0 && start.isBefore(earliestToday)) {
                    start = earliestToday;
                }
                if (!start.isBefore(block.getEnd())) {
                    continue; // Already over today
                }
                if (current != null && !start.isAfter(current.range.end)) {
                    current.absorb(block, block.getEnd());
                } else {
                    current = new OpenSegment(date, new TimeRange(start, block.getEnd()), block);
                    segments.add(current);
                }
            }
        }
        return segments;
    }

    private Map<LocalDate, List<TimeRange>> collectBusyTime(List<PlannedTask> tasks) {
        Map<LocalDate, List<TimeRange>> busy = new HashMap<>();
        for (PlannedTask task : tasks) {
            if (task.getScheduledDate() == null || task.getScheduledStart() == null || task.getScheduledEnd() == null
                    || !task.getScheduledStart().isBefore(task.getScheduledEnd())) {
                log.warn("Ignoring planned task {} with incomplete or inverted time range", task.getId());
                continue;
            }
            busy.computeIfAbsent(task.getScheduledDate(), d -> new ArrayList<>())
                    .add(new TimeRange(task.getScheduledStart(), task.getScheduledEnd()));
        }
        return busy;
    }

    /**
     * Earliest free piece (by date, then start) that can hold the session. With a due date, the
     * session must also end at or before it.
     */
    private Optional<FreePiece> findEarliest(List<OpenSegment> segments, Map<LocalDate, List<TimeRange>> busy,
                                             int durationMinutes, LocalDateTime dueDate) {
        return segments.stream()
                .flatMap(segment -> freePieces(segment, busy.getOrDefault(segment.date, List.of())).stream())
                .filter(piece -> piece.range.minutes() >= durationMinutes)
                .filter(piece -> dueDate == null
                        || !LocalDateTime.of(piece.date, piece.range.start.plusMinutes(durationMinutes)).isAfter(dueDate))
                .min(Comparator.comparing((FreePiece piece) -> piece.date).thenComparing(piece -> piece.range.start));
    }

    private List<FreePiece> freePieces(OpenSegment segment, List<TimeRange> busyRanges) {
        List<TimeRange> sorted = busyRanges.stream()
                .sorted(Comparator.comparing((TimeRange range) -> range.start))
                .collect(Collectors.toList());
        List<FreePiece> pieces = new ArrayList<>();
        LocalTime cursor = segment.range.start;
        for (TimeRange taken : sorted) {
            if (!taken.end.isAfter(cursor) || !taken.start.isBefore(segment.range.end)) {
                continue;
            }
            if (taken.start.isAfter(cursor)) {
                pieces.add(new FreePiece(segment, new TimeRange(cursor, taken.start)));
            }
            cursor = taken.end;
            if (!cursor.isBefore(segment.range.end)) {
                break;
            }
        }
        if (cursor.isBefore(segment.range.end)) {
            pieces.add(new FreePiece(segment, new TimeRange(cursor, segment.range.end)));
        }
        return pieces;
    }

    private String buildReason(Assignment assignment, FreePiece piece, LocalTime start, boolean beforeDeadline) {
        AvailabilityBlock block = piece.segment.blockCovering(start);
        String day = piece.date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        String where = String.format("your %s %s (%s-%s)%s",
                day,
                block.displayName(),
                block.getStart().format(TIME_FORMATTER),
                block.getEnd().format(TIME_FORMATTER),
                block.getLocation() != null && !block.getLocation().isBlank() ? " at " + block.getLocation() : "");

        StringBuilder reason = new StringBuilder();
        LocalDateTime due = assignment.getDueDate();
        if (due == null) {
            reason.append("No due date, so this takes the earliest open time in ").append(where).append('.');
        } else if (beforeDeadline) {
            long daysAhead = ChronoUnit.DAYS.between(piece.date, due.toLocalDate());
            reason.append("Due ").append(due.format(DUE_FORMATTER)).append("; scheduled in ").append(where);
            reason.append(daysAhead == 0 ? ", finishing on the due date." : ", finishing " + daysAhead + (daysAhead == 1 ? " day" : " days") + " before the deadline.");
        } else {
            reason.append("No open slot fits before the ").append(due.format(DUE_FORMATTER))
                    .append(" deadline; this is the earliest available time in ").append(where).append('.');
        }
        if (assignment.getPriority() == AssignmentPriority.HIGH) {
            reason.append(" Marked high priority.");
        }
        return reason.toString();
    }

    private static LocalTime ceilToMinute(LocalTime time) {
        LocalTime floored = time.truncatedTo(ChronoUnit.MINUTES);
        return floored.equals(time) ? floored : floored.plusMinutes(1);
    }

    private static final class TimeRange {
        private final LocalTime start;
        private final LocalTime end;

        private TimeRange(LocalTime start, LocalTime end) {
            this.start = start;
            this.end = end;
        }

        private long minutes() {
            return Duration.between(start, end).toMinutes();
        }
    }

    /**
     * Union of overlapping eligible blocks on one date.
     */
    private static final class OpenSegment {
        private final LocalDate date;
        private TimeRange range;
        private final List<AvailabilityBlock> blocks = new ArrayList<>();

        private OpenSegment(LocalDate date, TimeRange range, AvailabilityBlock block) {
            this.date = date;
            this.range = range;
            this.blocks.add(block);
        }

        private void absorb(AvailabilityBlock block, LocalTime blockEnd) {
            blocks.add(block);
            if (blockEnd.isAfter(range.end)) {
                range = new TimeRange(range.start, blockEnd);
            }
        }

        private AvailabilityBlock blockCovering(LocalTime time) {
            return blocks.stream()
                    .filter(block -> !time.isBefore(block.getStart()) && time.isBefore(block.getEnd()))
                    .findFirst()
                    .orElse(blocks.get(0));
        }
    }

    private static final class FreePiece {
        private final OpenSegment segment;
        private final LocalDate date;
        private final TimeRange range;

        private FreePiece(OpenSegment segment, TimeRange range) {
            this.segment = segment;
            this.date = segment.date;
            this.range = range;
        }
    }
}
