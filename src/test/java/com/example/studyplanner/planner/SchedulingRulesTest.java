package com.example.studyplanner.planner;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulingRulesTest {

    @Test
    void normalizeHours_fallsBackToDefaultForMissingOrInvalidInput() {
        assertThat(SchedulingRules.normalizeHours(null)).isEqualTo(2.0);
        assertThat(SchedulingRules.normalizeHours("")).isEqualTo(2.0);
        assertThat(SchedulingRules.normalizeHours("two hours")).isEqualTo(2.0);
        assertThat(SchedulingRules.normalizeHours("NaN")).isEqualTo(2.0);
        assertThat(SchedulingRules.normalizeHours("Infinity")).isEqualTo(2.0);
    }

    @Test
    void normalizeHours_clampsToAllowedRange() {
        assertThat(SchedulingRules.normalizeHours("0.1")).isEqualTo(0.5);
        assertThat(SchedulingRules.normalizeHours("-3")).isEqualTo(0.5);
        assertThat(SchedulingRules.normalizeHours(" 3.5 ")).isEqualTo(3.5);
        assertThat(SchedulingRules.normalizeHours("10")).isEqualTo(6.0);
    }

    @Test
    void toDuration_convertsFractionalHours() {
        assertThat(SchedulingRules.toDuration(1.25)).isEqualTo(Duration.ofMinutes(75));
        assertThat(SchedulingRules.toDuration(0.5)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void workItemRequest_ofNormalizesEstimate() {
        WorkItemRequest request = WorkItemRequest.of(0, null, "abc", null, null);

        assertThat(request.duration()).isEqualTo(Duration.ofHours(2));
        assertThat(request.displayTitle()).isEqualTo("Subtask");
    }

    @Test
    void timeInterval_rejectsEmptyOrInvertedRange() {
        ZonedDateTime t = ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.UTC);

        assertThatThrownBy(() -> new TimeInterval(t, t)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeInterval(t, t.minusMinutes(1))).isInstanceOf(IllegalArgumentException.class);
        assertThat(TimeInterval.ofPositive(t, t)).isNull();
    }

    @Test
    void timeInterval_ordersByInstantAcrossZones() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        // 10:00-12:00 Tokyo is 01:00-03:00 UTC
        TimeInterval tokyoMorning = new TimeInterval(
                ZonedDateTime.of(2026, 3, 2, 10, 0, 0, 0, tokyo),
                ZonedDateTime.of(2026, 3, 2, 12, 0, 0, 0, tokyo));
        TimeInterval utcShort = new TimeInterval(
                ZonedDateTime.of(2026, 3, 2, 1, 0, 0, 0, ZoneOffset.UTC),
                ZonedDateTime.of(2026, 3, 2, 2, 0, 0, 0, ZoneOffset.UTC));
        TimeInterval utcLater = new TimeInterval(
                ZonedDateTime.of(2026, 3, 2, 2, 0, 0, 0, ZoneOffset.UTC),
                ZonedDateTime.of(2026, 3, 2, 3, 0, 0, 0, ZoneOffset.UTC));

        List<TimeInterval> sorted = new ArrayList<>(List.of(utcLater, tokyoMorning, utcShort));
        Collections.sort(sorted);

        assertThat(sorted).containsExactly(utcShort, tokyoMorning, utcLater);
    }
}
