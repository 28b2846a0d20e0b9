package com.example.studyplanner.config;

import com.example.studyplanner.planner.SchedulingRules;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
public class PlannerSettings {
    private final ZoneId zone;
    private final int horizonDays;
    private final int busyLookaheadDays;

    public PlannerSettings(
            @Value("${planner.zone:}") String zone,
            @Value("${planner.horizon-days:" + SchedulingRules.DEFAULT_HORIZON_DAYS + "}") int horizonDays,
            @Value("${planner.busy-lookahead-days:30}") int busyLookaheadDays) {
        this.zone = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
        this.horizonDays = Math.min(SchedulingRules.MAX_HORIZON_DAYS, Math.max(1, horizonDays));
        this.busyLookaheadDays = Math.max(1, busyLookaheadDays);
    }

    public ZoneId getZone() { return zone; }
    public int getHorizonDays() { return horizonDays; }
    public int getBusyLookaheadDays() { return busyLookaheadDays; }
}
