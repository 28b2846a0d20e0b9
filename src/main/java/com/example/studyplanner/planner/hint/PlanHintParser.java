package com.example.studyplanner.planner.hint;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves free-text preferred-time hints ("2026-03-04 evening", "4 Mar 2026", "Tuesday afternoon")
 * into timestamps before they reach the scheduler.
 */
public final class PlanHintParser {

    static final LocalTime DEFAULT_HOUR = LocalTime.of(9, 0);

    // first match wins
    private static final List<Map.Entry<String, LocalTime>> TIME_OF_DAY = List.of(
            Map.entry("evening", LocalTime.of(19, 0)),
            Map.entry("afternoon", LocalTime.of(14, 0)),
            Map.entry("morning", LocalTime.of(10, 0)),
            Map.entry("night", LocalTime.of(21, 0)));

    private static final Pattern TIME_OF_DAY_WORDS = Pattern.compile("\\b(evening|afternoon|morning|night)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final DateTimeFormatter DATE_TIME = formatter("yyyy-MM-dd HH:mm");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("yyyy-MM-dd"),
            formatter("d MMM yyyy"),
            formatter("d MMMM yyyy"),
            formatter("MMM d yyyy"),
            formatter("MMMM d yyyy"));

    private PlanHintParser() {
    }

    /**
     * @param now reference point for relative hints; its zone is applied to hints without an offset
     * @return the resolved timestamp, or {@code null} when the hint is empty or not understood
     */
    public static ZonedDateTime parse(String hint, ZonedDateTime now) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String value = hint.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        LocalTime hour = hourFor(lower);
        String datePart = TIME_OF_DAY_WORDS.matcher(value).replaceAll("").trim().replaceAll("\\s+", " ");

        try {
            return LocalDateTime.parse(datePart, DATE_TIME).atZone(now.getZone());
        } catch (DateTimeParseException ignored) {
            // not a date with time
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(datePart, format).atTime(hour).atZone(now.getZone());
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        ZonedDateTime relative = parseRelative(datePart.toLowerCase(Locale.ROOT), hour, now);
        if (relative != null) {
            return relative;
        }
        return parseIso(value, now);
    }

    static LocalTime hourFor(String lower) {
        for (Map.Entry<String, LocalTime> entry : TIME_OF_DAY) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_HOUR;
    }

    private static ZonedDateTime parseRelative(String words, LocalTime hour, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        if (words.equals("today")) {
            return today.atTime(hour).atZone(now.getZone());
        }
        if (words.equals("tomorrow")) {
            return today.plusDays(1).atTime(hour).atZone(now.getZone());
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name().toLowerCase(Locale.ROOT);
            if (words.equals(name) || words.equals("next " + name)) {
                ZonedDateTime candidate = today.with(TemporalAdjusters.nextOrSame(day)).atTime(hour).atZone(now.getZone());
                return candidate.isAfter(now) ? candidate : candidate.plusWeeks(1);
            }
        }
        return null;
    }

    private static ZonedDateTime parseIso(String value, ZonedDateTime now) {
        try {
            return OffsetDateTime.parse(value).toZonedDateTime();
        } catch (DateTimeParseException ignored) {
            // no offset given
        }
        try {
            return LocalDateTime.parse(value).atZone(now.getZone());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
