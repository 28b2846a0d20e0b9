package com.example.studyplanner.planner.web;

import java.util.List;

/**
 * @param unscheduled the submitted subtasks that found no slot, unchanged and in submission order
 */
public record PlanResponse(List<PlannedEventDto> events, List<SubtaskPayload> unscheduled, String message,
                           int freeSlotCount) {
    public PlanResponse {
        events = events == null ? List.of() : List.copyOf(events);
        unscheduled = unscheduled == null ? List.of() : List.copyOf(unscheduled);
    }
}
