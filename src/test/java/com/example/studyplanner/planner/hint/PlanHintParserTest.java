package com.example.studyplanner.planner.hint;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class PlanHintParserTest {

    // Monday
    private static final ZonedDateTime NOW = ZonedDateTime.of(2026, 3, 2, 8, 0, 0, 0, ZoneOffset.UTC);

    private static ZonedDateTime at(int day, int hour, int minute) {
        return ZonedDateTime.of(2026, 3, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void parse_emptyHint_returnsNull() {
        assertThat(PlanHintParser.parse(null, NOW)).isNull();
        assertThat(PlanHintParser.parse("   ", NOW)).isNull();
    }

    @Test
    void parse_isoDate_usesDefaultHour() {
        assertThat(PlanHintParser.parse("2026-03-04", NOW)).isEqualTo(at(4, 9, 0));
    }

    @Test
    void parse_dateWithTimeOfDay_usesMatchingHour() {
        assertThat(PlanHintParser.parse("2026-03-04 evening", NOW)).isEqualTo(at(4, 19, 0));
        assertThat(PlanHintParser.parse("4 Mar 2026 afternoon", NOW)).isEqualTo(at(4, 14, 0));
        assertThat(PlanHintParser.parse("March 4 2026 morning", NOW)).isEqualTo(at(4, 10, 0));
        assertThat(PlanHintParser.parse("4 MARCH 2026 night", NOW)).isEqualTo(at(4, 21, 0));
        assertThat(PlanHintParser.parse("mar 4 2026", NOW)).isEqualTo(at(4, 9, 0));
    }

    @Test
    void parse_explicitTime_isKept() {
        assertThat(PlanHintParser.parse("2026-03-04 15:45", NOW)).isEqualTo(at(4, 15, 45));
    }

    @Test
    void parse_isoDateTime_keepsOffsetOrAppliesZone() {
        assertThat(PlanHintParser.parse("2026-03-04T16:00:00+02:00", NOW).toInstant())
                .isEqualTo(at(4, 14, 0).toInstant());
        assertThat(PlanHintParser.parse("2026-03-04T16:00", NOW)).isEqualTo(at(4, 16, 0));
    }

    @Test
    void parse_relativeWords_resolveAgainstNow() {
        assertThat(PlanHintParser.parse("tomorrow morning", NOW)).isEqualTo(at(3, 10, 0));
        assertThat(PlanHintParser.parse("today evening", NOW)).isEqualTo(at(2, 19, 0));
        assertThat(PlanHintParser.parse("Tuesday evening", NOW)).isEqualTo(at(3, 19, 0));
        assertThat(PlanHintParser.parse("next Friday", NOW)).isEqualTo(at(6, 9, 0));
    }

    @Test
    void parse_sameWeekday_movesToNextWeekOncePassed() {
        assertThat(PlanHintParser.parse("Monday afternoon", NOW)).isEqualTo(at(2, 14, 0));
        assertThat(PlanHintParser.parse("Monday", NOW.withHour(12))).isEqualTo(at(9, 9, 0));
    }

    @Test
    void parse_unknownText_returnsNull() {
        assertThat(PlanHintParser.parse("whenever works", NOW)).isNull();
        assertThat(PlanHintParser.parse("2026-13-40", NOW)).isNull();
    }

    @Test
    void parse_appliesZoneOfNow() {
        ZonedDateTime london = NOW.withZoneSameInstant(ZoneId.of("Europe/London"));

        assertThat(PlanHintParser.parse("2026-03-04 evening", london).getZone()).isEqualTo(ZoneId.of("Europe/London"));
    }
}
