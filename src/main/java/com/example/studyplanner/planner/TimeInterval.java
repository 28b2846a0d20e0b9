package com.example.studyplanner.planner;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Half-open range {@code [start, end)} used for busy intervals, free slots and placements alike.
 */
public record TimeInterval(ZonedDateTime start, ZonedDateTime end) implements Comparable<TimeInterval> {

    private static final Comparator<TimeInterval> ORDER = Comparator
            .comparing((TimeInterval interval) -> interval.start().toInstant())
            .thenComparing(interval -> interval.end().toInstant());

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start must be before end: " + start + " / " + end);
        }
    }

    /**
     * Returns an interval only when {@code start < end}, otherwise {@code null}.
     */
    public static TimeInterval ofPositive(ZonedDateTime start, ZonedDateTime end) {
        return start.isBefore(end) ? new TimeInterval(start, end) : null;
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(ZonedDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean fits(Duration required) {
        return duration().compareTo(required) >= 0;
    }

    public TimeInterval withTrailing(Duration extra) {
        return new TimeInterval(start, end.plus(extra));
    }

    public LocalDate startDate() {
        return start.toLocalDate();
    }

    @Override
    public int compareTo(TimeInterval other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + start + " - " + end + ")";
    }
}
