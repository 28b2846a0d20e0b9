package com.example.studyplanner.planner.hint;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Turns a task's due date into the deadline the scheduler spreads work towards.
 */
public final class DueDateParser {

    /** A task due on a date is due at the end of that day. */
    public static final LocalTime DUE_TIME = LocalTime.of(23, 59);

    private DueDateParser() {
    }

    /**
     * @return 23:59 of the given {@code yyyy-MM-dd} date in {@code zone}, or {@code null} when absent or malformed
     */
    public static ZonedDateTime parse(String dueDate, ZoneId zone) {
        if (dueDate == null || dueDate.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.of(LocalDate.parse(dueDate.trim()), DUE_TIME, zone);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
