package com.prakash.studyplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "schedule_suggestions")
@CompoundIndexes({
        @CompoundIndex(name = "user_status_idx", def = "{'userId': 1, 'status': 1}"),
        // At most one pending suggestion per slot, even when two generation runs race
        @CompoundIndex(name = "pending_slot_idx",
                def = "{'userId': 1, 'assignmentId': 1, 'suggestedDate': 1, 'suggestedStart': 1, 'suggestedEnd': 1}",
                unique = true,
                partialFilter = "{'status': 'PENDING'}")
})
public class ScheduleSuggestion {

    @Id
    private String id;

    private String userId;
    private String assignmentId;
    private LocalDate suggestedDate;
    private LocalTime suggestedStart;
    private LocalTime suggestedEnd;
    private String reason;

    @Builder.Default
    private SuggestionStatus status = SuggestionStatus.PENDING;

    private String resolutionToken; // Id of the resolve call that moved it out of PENDING
    private LocalDateTime resolvedAt;

    @CreatedDate
    private LocalDateTime createdAt;

    /**
     * Two suggestions occupy the same slot for the same assignment. Used to keep repeated
     * generation runs from re-offering what is already pending.
     */
    public boolean sameSlotAs(ScheduleSuggestion other) {
        return other != null
                && Objects.equals(assignmentId, other.assignmentId)
                && Objects.equals(suggestedDate, other.suggestedDate)
                && Objects.equals(suggestedStart, other.suggestedStart)
                && Objects.equals(suggestedEnd, other.suggestedEnd);
    }
}
