package com.prakash.studyplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String error;
    private boolean needsSchedule;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, false);
    }
}
