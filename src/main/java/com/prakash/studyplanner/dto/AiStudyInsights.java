package com.prakash.studyplanner.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor // Required for BeanOutputConverter
public class AiStudyInsights {

    // Must match the field named in the prompt's format instructions
    private String insights;
}
