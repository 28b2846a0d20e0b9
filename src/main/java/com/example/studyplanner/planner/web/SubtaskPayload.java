package com.example.studyplanner.planner.web;

import jakarta.validation.constraints.Size;

/**
 * One proposed work item as produced by the task breakdown.
 *
 * @param estimatedHours free-form number; missing or unparsable values mean 2 hours
 * @param plannedStart   optional preferred-time hint such as "2026-03-04 evening"
 */
public record SubtaskPayload(
        @Size(max = 200, message = "Subtask title must be at most 200 characters") String title,
        String estimatedHours,
        String plannedStart,
        @Size(max = 200, message = "Focus must be at most 200 characters") String focus
) {
}
