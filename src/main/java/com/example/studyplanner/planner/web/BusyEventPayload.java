package com.example.studyplanner.planner.web;

import java.time.OffsetDateTime;

/**
 * Existing calendar entry. Entries missing either timestamp are ignored.
 */
public record BusyEventPayload(String title, OffsetDateTime start, OffsetDateTime end) {
}
