package com.example.studyplanner.planner;

import java.util.List;

public record ScheduleResult(List<ScheduledAssignment> scheduled, List<WorkItemRequest> unscheduled) {

    public ScheduleResult {
        scheduled = scheduled == null ? List.of() : List.copyOf(scheduled);
        unscheduled = unscheduled == null ? List.of() : List.copyOf(unscheduled);
    }

    public static ScheduleResult allUnscheduled(List<WorkItemRequest> requests) {
        return new ScheduleResult(List.of(), requests);
    }

    public boolean hasUnscheduled() {
        return !unscheduled.isEmpty();
    }
}
