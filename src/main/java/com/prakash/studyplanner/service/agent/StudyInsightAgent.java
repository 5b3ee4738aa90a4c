package com.prakash.studyplanner.service.agent;

import com.prakash.studyplanner.dto.AiStudyInsights;
import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class StudyInsightAgent {

    private static final Logger log = LoggerFactory.getLogger(StudyInsightAgent.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ChatModel chatModel;

    // Prompt template for the study-tips paragraph shown next to the suggestions
    private final String insightsPromptTemplate = """
            You are a friendly study coach helping a student plan the next two weeks.
            Today's date is: {today}

            Pending assignments (most urgent first):
            {assignments}

            Proposed study sessions:
            {sessions}

            Write one short paragraph of practical study tips for this workload.
            Mention the most urgent work, warn about deadlines that are tight, and suggest leaving buffer time.
            Do not repeat the full schedule back.

            {format}
            """;

    @Autowired
    public StudyInsightAgent(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    /**
     * Asks the chat model for study tips about the workload and the proposed sessions.
     *
     * @param assignments The open assignments, in urgency order.
     * @param sessions    The sessions proposed for them.
     * @param today       The user's current date.
     * @return The insights paragraph, never null.
     * @throws RuntimeException if the AI interaction or parsing fails.
     */
    public String generateInsights(List<Assignment> assignments, List<ScheduleSuggestion> sessions, LocalDate today) {
        log.info("Generating study insights for {} assignments and {} sessions", assignments.size(), sessions.size());

        BeanOutputConverter<AiStudyInsights> outputConverter = new BeanOutputConverter<>(AiStudyInsights.class);
        Map<String, Assignment> byId = assignments.stream()
                .collect(Collectors.toMap(Assignment::getId, Function.identity(), (first, second) -> first));

        PromptTemplate promptTemplate = new PromptTemplate(insightsPromptTemplate);
        Prompt prompt = promptTemplate.create(Map.of(
                "today", today.format(DATE_FORMATTER),
                "assignments", formatAssignments(assignments),
                "sessions", formatSessions(sessions, byId),
                "format", outputConverter.getFormat()
        ));
        log.debug("Sending insights prompt to AI: \n{}", prompt.getInstructions());

        try {
            var chatResponse = chatModel.call(prompt);
            String rawResponse = chatResponse.getResult().getOutput().getText();
            log.debug("Received raw AI response for insights: \n{}", rawResponse);

            AiStudyInsights insights = outputConverter.convert(rawResponse);
            if (insights == null || insights.getInsights() == null) {
                log.warn("AI response parsed, but 'insights' is null. Returning empty insights.");
                return "";
            }
            return insights.getInsights();
        } catch (Exception e) {
            log.error("Failed to generate or parse study insights: {}", e.getMessage(), e);
            throw new RuntimeException("AI study insights generation failed", e);
        }
    }

    private String formatAssignments(List<Assignment> assignments) {
        if (CollectionUtils.isEmpty(assignments)) {
            return "None.";
        }
        return assignments.stream()
                .map(a -> String.format("- %s (course: %s, due: %s, priority: %s, estimated minutes: %s)",
                        a.getTitle(),
                        a.getCourseName() != null ? a.getCourseName() : "Unknown",
                        a.getDueDate() != null ? a.getDueDate().toString() : "none",
                        a.getPriority() != null ? a.getPriority().name() : "MEDIUM",
                        a.getEstimatedDurationMinutes() != null ? a.getEstimatedDurationMinutes() : "unknown"))
                .collect(Collectors.joining("\n"));
    }

    private String formatSessions(List<ScheduleSuggestion> sessions, Map<String, Assignment> byId) {
        if (CollectionUtils.isEmpty(sessions)) {
            return "None could be placed.";
        }
        return sessions.stream()
                .map(s -> String.format("- %s %s-%s: %s",
                        s.getSuggestedDate().format(DATE_FORMATTER),
                        s.getSuggestedStart(),
                        s.getSuggestedEnd(),
                        byId.containsKey(s.getAssignmentId()) ? byId.get(s.getAssignmentId()).getTitle() : s.getAssignmentId()))
                .collect(Collectors.joining("\n"));
    }
}
