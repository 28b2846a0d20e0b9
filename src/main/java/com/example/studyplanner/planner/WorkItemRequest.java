package com.example.studyplanner.planner;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * One item to place.
 *
 * @param position       0-based index in the caller's sequence, used to spread items towards a deadline
 * @param title          item title, may be blank
 * @param duration       estimated length, already clamped
 * @param preferredStart resolved preferred-time hint, or {@code null}
 * @param focus          optional category tag carried through to the placement
 */
public record WorkItemRequest(int position,
                              String title,
                              Duration duration,
                              ZonedDateTime preferredStart,
                              String focus) {

    public WorkItemRequest {
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
        Objects.requireNonNull(duration, "duration");
    }

    public static WorkItemRequest of(int position, String title, String estimatedHours,
                                     ZonedDateTime preferredStart, String focus) {
        double hours = SchedulingRules.normalizeHours(estimatedHours);
        return new WorkItemRequest(position, title, SchedulingRules.toDuration(hours), preferredStart, focus);
    }

    public String displayTitle() {
        return title == null || title.isBlank() ? SchedulingRules.DEFAULT_TITLE : title;
    }
}
