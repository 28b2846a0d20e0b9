package com.example.studyplanner.planner;

/**
 * A placed item. The caller persists it as a calendar entry.
 */
public record ScheduledAssignment(String title, TimeInterval interval, String focus, WorkItemRequest request) {

    public static ScheduledAssignment of(String taskTitle, WorkItemRequest request, TimeInterval interval) {
        return new ScheduledAssignment(deriveTitle(taskTitle, request), interval, request.focus(), request);
    }

    static String deriveTitle(String taskTitle, WorkItemRequest request) {
        if (taskTitle == null || taskTitle.isBlank()) {
            return request.displayTitle();
        }
        return taskTitle + ": " + request.displayTitle();
    }
}
