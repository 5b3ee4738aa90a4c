package com.prakash.studyplanner.service;

import com.prakash.studyplanner.dto.PlannedTaskRequest;
import com.prakash.studyplanner.dto.PlannedTaskUpdateRequest;
import com.prakash.studyplanner.exception.InvalidRequestException;
import com.prakash.studyplanner.exception.PlannedTaskNotFoundException;
import com.prakash.studyplanner.model.PlannedTask;
import com.prakash.studyplanner.model.TaskType;
import com.prakash.studyplanner.repository.PlannedTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlannedTaskServiceTest {

    private static final String USER = "user-1";
    private static final LocalDate TUESDAY = LocalDate.of(2026, 10, 20);

    @Mock PlannedTaskRepository plannedTaskRepository;

    PlannedTaskService service;

    @BeforeEach
    void setUp() {
        service = new PlannedTaskService(plannedTaskRepository);
    }

    @Test
    void getTasks_byDate_returnsThatDayInStartOrder() {
        when(plannedTaskRepository.findByUserIdAndScheduledDate(USER, TUESDAY)).thenReturn(List.of(
                task("t-2", TUESDAY, "16:00"),
                task("t-1", TUESDAY, "09:00")));

        assertThat(service.getTasks(USER, TUESDAY, null, null))
                .extracting(PlannedTask::getId).containsExactly("t-1", "t-2");
    }

    @Test
    void getTasks_byRange_usesInclusiveRangeQuery() {
        LocalDate end = TUESDAY.plusDays(6);
        when(plannedTaskRepository.findByUserIdAndScheduledDateWithin(USER, TUESDAY, end)).thenReturn(List.of(
                task("t-late", end, "08:00"),
                task("t-early", TUESDAY, "18:00")));

        assertThat(service.getTasks(USER, null, TUESDAY, end))
                .extracting(PlannedTask::getId).containsExactly("t-early", "t-late");
    }

    @Test
    void getTasks_withInvertedRange_isRejected() {
        assertThatThrownBy(() -> service.getTasks(USER, null, TUESDAY, TUESDAY.minusDays(1)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void createTask_isManualWithDefaultType() {
        when(plannedTaskRepository.save(any(PlannedTask.class))).thenAnswer(invocation -> invocation.getArgument(0));
        PlannedTaskRequest request = PlannedTaskRequest.builder()
                .title("Flashcards")
                .scheduledDate(TUESDAY)
                .scheduledStart(LocalTime.of(19, 0))
                .scheduledEnd(LocalTime.of(19, 30))
                .build();

        PlannedTask created = service.createTask(USER, request);

        assertThat(created.getUserId()).isEqualTo(USER);
        assertThat(created.getTaskType()).isEqualTo(TaskType.ASSIGNMENT);
        assertThat(created.isAiGenerated()).isFalse();
        assertThat(created.isCompleted()).isFalse();
        assertThat(created.getSourceSuggestionId()).isNull();
    }

    @Test
    void createTask_withEmptyTimeRange_isRejected() {
        PlannedTaskRequest request = PlannedTaskRequest.builder()
                .scheduledDate(TUESDAY)
                .scheduledStart(LocalTime.of(19, 0))
                .scheduledEnd(LocalTime.of(19, 0))
                .build();

        assertThatThrownBy(() -> service.createTask(USER, request)).isInstanceOf(InvalidRequestException.class);
        verify(plannedTaskRepository, never()).save(any(PlannedTask.class));
    }

    @Test
    void updateTask_marksCompletedWithoutTouchingSchedule() {
        PlannedTask existing = task("t-1", TUESDAY, "15:00");
        when(plannedTaskRepository.findByIdAndUserId("t-1", USER)).thenReturn(Optional.of(existing));
        when(plannedTaskRepository.save(existing)).thenReturn(existing);

        PlannedTask updated = service.updateTask(USER, "t-1", PlannedTaskUpdateRequest.builder().completed(true).build());

        assertThat(updated.isCompleted()).isTrue();
        assertThat(updated.getScheduledStart()).isEqualTo(LocalTime.of(15, 0));
    }

    @Test
    void deleteTask_ofAnotherUser_isNotFound() {
        when(plannedTaskRepository.findByIdAndUserId("t-x", USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteTask(USER, "t-x")).isInstanceOf(PlannedTaskNotFoundException.class);
        verify(plannedTaskRepository, never()).delete(any(PlannedTask.class));
    }

    private static PlannedTask task(String id, LocalDate date, String start) {
        LocalTime from = LocalTime.parse(start);
        return PlannedTask.builder()
                .id(id)
                .userId(USER)
                .scheduledDate(date)
                .scheduledStart(from)
                .scheduledEnd(from.plusHours(1))
                .build();
    }
}
