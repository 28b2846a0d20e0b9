package com.example.studyplanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PlannerConfig {

    /**
     * スケジューリングの現在時刻（planner.zone のタイムゾーン）
     */
    @Bean
    public Clock plannerClock(PlannerSettings settings) {
        return Clock.system(settings.getZone());
    }
}
