package com.example.studyplanner.planner;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Places a single item inside a free slot and computes what is left of the slot afterwards.
 */
public final class SlotConsumer {

    private SlotConsumer() {
    }

    /**
     * Interval the item would occupy in {@code slot}, without consuming anything.
     */
    public static Optional<TimeInterval> tentative(TimeInterval slot, Duration duration) {
        if (!slot.fits(SchedulingRules.requiredSpace(duration))) {
            return Optional.empty();
        }
        ZonedDateTime start = BoundaryRounder.alignedStart(slot.start());
        if (!start.isBefore(slot.end())) {
            return Optional.empty();
        }
        ZonedDateTime end = BoundaryRounder.roundUp(start.plus(duration));
        if (end.isAfter(slot.end())) {
            end = slot.end().truncatedTo(ChronoUnit.MINUTES);
        }
        return Optional.ofNullable(TimeInterval.ofPositive(start, end));
    }

    public static Optional<Consumption> consume(TimeInterval slot, Duration duration) {
        return tentative(slot, duration).map(assigned -> new Consumption(assigned, remainder(slot, assigned)));
    }

    static TimeInterval remainder(TimeInterval slot, TimeInterval assigned) {
        TimeInterval buffered = TimeInterval.ofPositive(assigned.end().plus(SchedulingRules.BUFFER), slot.end());
        if (buffered != null) {
            return buffered;
        }
        return TimeInterval.ofPositive(assigned.end(), slot.end());
    }

    /**
     * @param remainder what is left of the slot, or {@code null} when it was used up
     */
    public record Consumption(TimeInterval assigned, TimeInterval remainder) {

        public Optional<TimeInterval> remaining() {
            return Optional.ofNullable(remainder);
        }
    }
}
