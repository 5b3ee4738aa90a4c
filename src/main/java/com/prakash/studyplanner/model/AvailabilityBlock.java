package com.prakash.studyplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A recurring weekly window in which the user is in class, at work, or available to study.
 * Blocks of the same user may overlap; the planner copes with that.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "availability_blocks")
public class AvailabilityBlock {

    @Id
    private String id;

    @Indexed
    private String userId;

    private int dayOfWeek; // 0 = Sunday ... 6 = Saturday
    private LocalTime start;
    private LocalTime end;

    @Builder.Default
    private BlockType blockType = BlockType.STUDY;

    private String label;    // e.g. "Library block"
    private String location;

    @Builder.Default
    private boolean recurring = true;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    /**
     * Whether this block recurs on the given calendar day.
     */
    public boolean fallsOn(DayOfWeek day) {
        return dayOfWeek == day.getValue() % 7;
    }

    public String displayName() {
        return label != null && !label.isBlank() ? label : blockType.name().toLowerCase() + " block";
    }
}
