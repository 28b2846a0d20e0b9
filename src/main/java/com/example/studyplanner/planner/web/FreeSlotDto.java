package com.example.studyplanner.planner.web;

import com.example.studyplanner.planner.TimeInterval;

import java.time.OffsetDateTime;

public record FreeSlotDto(OffsetDateTime start, OffsetDateTime end, long durationMinutes) {

    public static FreeSlotDto from(TimeInterval slot) {
        return new FreeSlotDto(slot.start().toOffsetDateTime(), slot.end().toOffsetDateTime(), slot.duration().toMinutes());
    }
}
