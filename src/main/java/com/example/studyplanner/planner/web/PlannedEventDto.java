package com.example.studyplanner.planner.web;

import com.example.studyplanner.planner.ScheduledAssignment;

import java.time.OffsetDateTime;

/**
 * Calendar entry to create for a placed item.
 */
public record PlannedEventDto(
        String title,
        OffsetDateTime start,
        OffsetDateTime end,
        String location,
        Long moduleId) {

    public static PlannedEventDto from(ScheduledAssignment assignment, Long moduleId) {
        return new PlannedEventDto(
                assignment.title(),
                assignment.interval().start().toOffsetDateTime(),
                assignment.interval().end().toOffsetDateTime(),
                assignment.focus(),
                moduleId
        );
    }
}
