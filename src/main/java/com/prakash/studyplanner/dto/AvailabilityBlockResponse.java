package com.prakash.studyplanner.dto;

import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.model.BlockType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityBlockResponse {

    private String id;
    private int dayOfWeek;
    private LocalTime start;
    private LocalTime end;
    private BlockType blockType;
    private String label;
    private String location;
    private boolean recurring;

    public static AvailabilityBlockResponse fromEntity(AvailabilityBlock block) {
        if (block == null) {
            return null;
        }
        return AvailabilityBlockResponse.builder()
                .id(block.getId())
                .dayOfWeek(block.getDayOfWeek())
                .start(block.getStart())
                .end(block.getEnd())
                .blockType(block.getBlockType())
                .label(block.getLabel())
                .location(block.getLocation())
                .recurring(block.isRecurring())
                .build();
    }
}
