package com.example.studyplanner.planner;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Centralized placement constants so the generator, the scheduler and the API stay consistent.
 */
public final class SchedulingRules {

    public static final LocalTime WORKDAY_START = LocalTime.of(9, 0);
    public static final LocalTime WORKDAY_END = LocalTime.of(21, 0);

    /** Gap kept free after every placed item. */
    public static final Duration BUFFER = Duration.ofMinutes(30);
    /** Free segments shorter than this are discarded at generation time. */
    public static final Duration MIN_SLOT = Duration.ofMinutes(30);

    public static final double MIN_HOURS = 0.5;
    public static final double MAX_HOURS = 6.0;
    public static final double DEFAULT_HOURS = 2.0;

    public static final int DEFAULT_HORIZON_DAYS = 21;
    /** Upper bound for any requested horizon. */
    public static final int MAX_HORIZON_DAYS = 366;
    public static final String DEFAULT_TITLE = "Subtask";

    private SchedulingRules() {
    }

    /**
     * Normalizes a raw estimated-hours value. Missing or unparsable input falls back to
     * {@link #DEFAULT_HOURS}; the result is always clamped to [{@link #MIN_HOURS}, {@link #MAX_HOURS}].
     */
    public static double normalizeHours(String raw) {
        double hours = DEFAULT_HOURS;
        if (raw != null && !raw.isBlank()) {
            try {
                double parsed = Double.parseDouble(raw.trim());
                if (Double.isFinite(parsed)) {
                    hours = parsed;
                }
            } catch (NumberFormatException ignored) {
                // keep the default
            }
        }
        return Math.max(MIN_HOURS, Math.min(hours, MAX_HOURS));
    }

    public static Duration toDuration(double hours) {
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    /**
     * Space a slot must offer to host an item of the given length, trailing buffer included.
     */
    public static Duration requiredSpace(Duration duration) {
        return duration.plus(BUFFER);
    }
}
