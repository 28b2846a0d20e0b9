package com.example.studyplanner.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the free time left inside each day's working window once busy intervals are removed.
 */
@Component
public class FreeSlotGenerator {

    private static final Logger logger = LoggerFactory.getLogger(FreeSlotGenerator.class);

    public List<TimeInterval> generate(List<TimeInterval> busyIntervals, ZonedDateTime now) {
        return generate(busyIntervals, SchedulingRules.DEFAULT_HORIZON_DAYS, now);
    }

    /**
     * Returns the free segments of the next {@code horizonDays} calendar days (today included), in day order.
     * Segments never start before {@code now} and are at least {@link SchedulingRules#MIN_SLOT} long.
     * Day boundaries follow the zone of {@code now}.
     */
    public List<TimeInterval> generate(List<TimeInterval> busyIntervals, int horizonDays, ZonedDateTime now) {
        Objects.requireNonNull(busyIntervals, "busyIntervals");
        Objects.requireNonNull(now, "now");
        if (horizonDays < 0 || horizonDays > SchedulingRules.MAX_HORIZON_DAYS) {
            throw new IllegalArgumentException("horizonDays must be between 0 and "
                    + SchedulingRules.MAX_HORIZON_DAYS + ": " + horizonDays);
        }
        ZoneId zone = now.getZone();
        List<TimeInterval> busy = new ArrayList<>(busyIntervals.size());
        for (TimeInterval interval : busyIntervals) {
            busy.add(new TimeInterval(interval.start().withZoneSameInstant(zone), interval.end().withZoneSameInstant(zone)));
        }
        busy.sort(null);

        LocalDate firstDay = now.toLocalDate();
        List<TimeInterval> freeSlots = new ArrayList<>();
        for (int offset = 0; offset < horizonDays; offset++) {
            TimeInterval window = workingWindow(firstDay.plusDays(offset), zone, now);
            if (window == null) {
                continue;
            }
            List<TimeInterval> segments = List.of(window);
            for (TimeInterval interval : busy) {
                if (!interval.overlaps(window)) {
                    continue;
                }
                segments = IntervalSubtractor.subtract(segments, interval);
                if (segments.isEmpty()) {
                    break;
                }
            }
            for (TimeInterval segment : segments) {
                if (segment.fits(SchedulingRules.MIN_SLOT)) {
                    freeSlots.add(segment);
                }
            }
        }
        logger.debug("Generated {} free slots over {} days from {} busy intervals", freeSlots.size(), horizonDays, busy.size());
        return freeSlots;
    }

    /**
     * The day's working window clipped to {@code now}, or {@code null} once it has fully elapsed.
     */
    static TimeInterval workingWindow(LocalDate day, ZoneId zone, ZonedDateTime now) {
        ZonedDateTime dayStart = ZonedDateTime.of(day, SchedulingRules.WORKDAY_START, zone);
        ZonedDateTime dayEnd = ZonedDateTime.of(day, SchedulingRules.WORKDAY_END, zone);
        if (!dayEnd.isAfter(now)) {
            return null;
        }
        if (dayStart.isBefore(now)) {
            dayStart = now;
        }
        return new TimeInterval(dayStart, dayEnd);
    }
}
