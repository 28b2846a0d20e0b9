package com.example.studyplanner.planner.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * @param dueDate parent task due date ({@code yyyy-MM-dd}); ignored when {@code dueAt} is set
 */
public record PlanRequest(
        @Size(max = 200, message = "Task title must be at most 200 characters") String taskTitle,
        String dueDate,
        OffsetDateTime dueAt,
        Long moduleId,
        @Valid List<BusyEventPayload> busyEvents,
        @NotEmpty(message = "At least one subtask is required")
        @Size(max = 50, message = "At most 50 subtasks can be scheduled at once")
        List<@NotNull(message = "Subtask entries must not be null") @Valid SubtaskPayload> subtasks
) {
    public PlanRequest {
        busyEvents = busyEvents == null ? List.of() : busyEvents;
    }
}
