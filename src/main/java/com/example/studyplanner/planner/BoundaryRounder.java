package com.example.studyplanner.planner;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Snaps timestamps to the {@code :00}/{@code :30} grid used for every placed start and end.
 */
public final class BoundaryRounder {

    private BoundaryRounder() {
    }

    /**
     * Minutes [0,15) go to :30 unless the value is exactly on the hour, minutes [15,45) go to :30 and
     * minutes [45,60) go to the next full hour. Values in [30,45) therefore move backwards.
     */
    public static ZonedDateTime roundUp(ZonedDateTime timestamp) {
        if (isWholeHour(timestamp)) {
            return timestamp;
        }
        ZonedDateTime hour = timestamp.truncatedTo(ChronoUnit.HOURS);
        if (timestamp.getMinute() < 45) {
            return hour.plusMinutes(30);
        }
        return hour.plusHours(1);
    }

    /**
     * First grid line at or after the given timestamp.
     */
    public static ZonedDateTime ceil(ZonedDateTime timestamp) {
        if (isOnGrid(timestamp)) {
            return timestamp;
        }
        ZonedDateTime hour = timestamp.truncatedTo(ChronoUnit.HOURS);
        return timestamp.getMinute() < 30 ? hour.plusMinutes(30) : hour.plusHours(1);
    }

    /**
     * Start time an item gets in a slot opening at {@code slotStart}: rounded, never earlier than the slot.
     */
    public static ZonedDateTime alignedStart(ZonedDateTime slotStart) {
        ZonedDateTime rounded = roundUp(slotStart);
        if (rounded.isBefore(slotStart)) {
            rounded = ceil(slotStart);
        }
        return rounded;
    }

    public static boolean isOnGrid(ZonedDateTime timestamp) {
        int minute = timestamp.getMinute();
        return (minute == 0 || minute == 30) && timestamp.getSecond() == 0 && timestamp.getNano() == 0;
    }

    private static boolean isWholeHour(ZonedDateTime timestamp) {
        return timestamp.getMinute() == 0 && timestamp.getSecond() == 0 && timestamp.getNano() == 0;
    }
}
