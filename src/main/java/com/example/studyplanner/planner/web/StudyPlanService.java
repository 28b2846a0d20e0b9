package com.example.studyplanner.planner.web;

import com.example.studyplanner.config.PlannerSettings;
import com.example.studyplanner.planner.FreeSlotGenerator;
import com.example.studyplanner.planner.PlacementScheduler;
import com.example.studyplanner.planner.ScheduleResult;
import com.example.studyplanner.planner.TimeInterval;
import com.example.studyplanner.planner.WorkItemRequest;
import com.example.studyplanner.planner.hint.DueDateParser;
import com.example.studyplanner.planner.hint.PlanHintParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one scheduling pass for a task breakdown: adapts the calendar and the proposed subtasks,
 * places them, and returns the calendar entries to create.
 */
@Service
public class StudyPlanService {
    private static final Logger logger = LoggerFactory.getLogger(StudyPlanService.class);

    private final FreeSlotGenerator freeSlotGenerator;
    private final PlacementScheduler placementScheduler;
    private final PlannerSettings settings;
    private final Clock clock;

    public StudyPlanService(FreeSlotGenerator freeSlotGenerator,
                            PlacementScheduler placementScheduler,
                            PlannerSettings settings,
                            Clock clock) {
        this.freeSlotGenerator = freeSlotGenerator;
        this.placementScheduler = placementScheduler;
        this.settings = settings;
        this.clock = clock;
    }

    public PlanResponse plan(PlanRequest request) {
        ZonedDateTime now = now();
        List<TimeInterval> busy = toBusyIntervals(request.busyEvents(), now);
        List<TimeInterval> freeSlots = freeSlotGenerator.generate(busy, settings.getHorizonDays(), now);
        ZonedDateTime deadline = resolveDeadline(request, now);
        logger.info("Planning {} subtasks for '{}' ({} busy intervals, {} free slots, deadline {})",
                request.subtasks().size(), request.taskTitle(), busy.size(), freeSlots.size(), deadline);

        List<WorkItemRequest> items = new ArrayList<>(request.subtasks().size());
        for (int i = 0; i < request.subtasks().size(); i++) {
            SubtaskPayload subtask = request.subtasks().get(i);
            items.add(WorkItemRequest.of(i, subtask.title(), subtask.estimatedHours(),
                    PlanHintParser.parse(subtask.plannedStart(), now), subtask.focus()));
        }

        ScheduleResult result = placementScheduler.schedule(request.taskTitle(), items, freeSlots, deadline, now);
        List<PlannedEventDto> events = result.scheduled().stream()
                .map(assignment -> PlannedEventDto.from(assignment, request.moduleId()))
                .toList();
        List<SubtaskPayload> unscheduled = result.unscheduled().stream()
                .map(item -> request.subtasks().get(item.position()))
                .toList();
        return new PlanResponse(events, unscheduled, summarize(events.size(), unscheduled.size()), freeSlots.size());
    }

    public List<TimeInterval> freeSlots(List<BusyEventPayload> busyEvents, Integer horizonDays) {
        ZonedDateTime now = now();
        int horizon = horizonDays == null ? settings.getHorizonDays() : horizonDays;
        return freeSlotGenerator.generate(toBusyIntervals(busyEvents, now), horizon, now);
    }

    /**
     * Keeps complete, well-formed events that are still running or start within the look-ahead window.
     */
    List<TimeInterval> toBusyIntervals(List<BusyEventPayload> events, ZonedDateTime now) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        ZonedDateTime lookaheadEnd = now.plusDays(settings.getBusyLookaheadDays());
        List<TimeInterval> busy = new ArrayList<>();
        for (BusyEventPayload event : events) {
            if (event == null || event.start() == null || event.end() == null) {
                continue;
            }
            ZonedDateTime start = event.start().atZoneSameInstant(now.getZone());
            ZonedDateTime end = event.end().atZoneSameInstant(now.getZone());
            if (!start.isBefore(end)) {
                logger.warn("Ignoring calendar event '{}' with end {} not after start {}", event.title(), end, start);
                continue;
            }
            if (!end.isAfter(now) || start.isAfter(lookaheadEnd)) {
                continue;
            }
            busy.add(new TimeInterval(start, end));
        }
        return busy;
    }

    private ZonedDateTime resolveDeadline(PlanRequest request, ZonedDateTime now) {
        if (request.dueAt() != null) {
            return request.dueAt().atZoneSameInstant(now.getZone());
        }
        return DueDateParser.parse(request.dueDate(), now.getZone());
    }

    static String summarize(int scheduled, int unscheduled) {
        if (unscheduled == 0) {
            return scheduled == 1 ? "1 item scheduled" : scheduled + " items scheduled";
        }
        String noun = unscheduled == 1 ? "item" : "items";
        return unscheduled + " " + noun + " could not be scheduled due to limited availability";
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(settings.getZone());
    }
}
