package com.example.studyplanner.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Greedy placement of work items into free slots.
 * <p>
 * Items are handled strictly in input order. For each item the remaining slots are ranked by
 * (starts at/after the target time, items already placed on that day, distance to the target) and the
 * first slot that can host the item without colliding with an earlier placement is consumed.
 * Nothing is retried or re-balanced afterwards, so earlier items win when time is scarce.
 */
@Component
public class PlacementScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PlacementScheduler.class);

    public ScheduleResult schedule(List<WorkItemRequest> requests, List<TimeInterval> freeSlots,
                                   ZonedDateTime deadline, ZonedDateTime now) {
        return schedule(null, requests, freeSlots, deadline, now);
    }

    /**
     * @param taskTitle parent task title used to derive placement titles, may be {@code null}
     * @param deadline  optional deadline the items are spread towards
     */
    public ScheduleResult schedule(String taskTitle, List<WorkItemRequest> requests, List<TimeInterval> freeSlots,
                                   ZonedDateTime deadline, ZonedDateTime now) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(freeSlots, "freeSlots");
        Objects.requireNonNull(now, "now");
        if (freeSlots.isEmpty()) {
            logger.info("No free time available, {} items left unscheduled", requests.size());
            return ScheduleResult.allUnscheduled(requests);
        }

        SlotQueue queue = new SlotQueue(freeSlots);
        List<ScheduledAssignment> scheduled = new ArrayList<>();
        List<WorkItemRequest> unscheduled = new ArrayList<>();
        Map<LocalDate, Integer> perDay = new HashMap<>();

        for (WorkItemRequest request : requests) {
            ZonedDateTime target = targetTime(request, requests.size(), deadline, now);
            Optional<ScheduledAssignment> placed = place(taskTitle, request, target, queue, scheduled, perDay);
            if (placed.isPresent()) {
                ScheduledAssignment assignment = placed.get();
                scheduled.add(assignment);
                perDay.merge(assignment.interval().startDate(), 1, Integer::sum);
                logger.debug("Placed '{}' at {}", assignment.title(), assignment.interval());
            } else {
                unscheduled.add(request);
                logger.debug("No slot for item #{} ({} needed)", request.position(), request.duration());
            }
        }
        logger.info("Scheduling run finished: {} placed, {} unscheduled, {} slots left",
                scheduled.size(), unscheduled.size(), queue.size());
        return new ScheduleResult(scheduled, unscheduled);
    }

    /**
     * Preferred hint first, then a proportional point between now and the deadline,
     * otherwise one item per day starting today.
     */
    static ZonedDateTime targetTime(WorkItemRequest request, int count, ZonedDateTime deadline, ZonedDateTime now) {
        if (request.preferredStart() != null) {
            return request.preferredStart();
        }
        int index = request.position();
        if (deadline != null) {
            Duration window = Duration.between(now, deadline);
            if (window.compareTo(Duration.ofDays(1)) < 0) {
                window = Duration.ofDays(1);
            }
            long denominator = Math.max(count - 1, 1);
            // divide first: window * index overflows for far-off deadlines
            Duration offset = window.dividedBy(denominator).multipliedBy(index).truncatedTo(ChronoUnit.MILLIS);
            return now.plus(offset);
        }
        return now.plusDays(index);
    }

    private Optional<ScheduledAssignment> place(String taskTitle, WorkItemRequest request, ZonedDateTime target,
                                                SlotQueue queue, List<ScheduledAssignment> placed,
                                                Map<LocalDate, Integer> perDay) {
        for (int index : rankCandidates(queue, target, perDay)) {
            TimeInterval slot = queue.get(index);
            Optional<TimeInterval> tentative = SlotConsumer.tentative(slot, request.duration());
            if (tentative.isEmpty()) {
                continue;
            }
            if (collides(tentative.get(), placed)) {
                logger.debug("Slot {} rejected for item #{}: too close to an earlier placement", slot, request.position());
                continue;
            }
            Optional<SlotConsumer.Consumption> consumption = SlotConsumer.consume(slot, request.duration());
            if (consumption.isPresent()) {
                queue.shrink(index, consumption.get().remainder());
                return Optional.of(ScheduledAssignment.of(taskTitle, request, consumption.get().assigned()));
            }
        }
        return Optional.empty();
    }

    static List<Integer> rankCandidates(SlotQueue queue, ZonedDateTime target, Map<LocalDate, Integer> perDay) {
        List<Integer> indices = new ArrayList<>(queue.size());
        for (int i = 0; i < queue.size(); i++) {
            indices.add(i);
        }
        // List.sort is stable, so remaining ties keep queue order
        indices.sort(Comparator
                .comparingInt((Integer i) -> queue.get(i).start().isBefore(target) ? 1 : 0)
                .thenComparingInt(i -> perDay.getOrDefault(queue.get(i).startDate(), 0))
                .thenComparing(i -> Duration.between(queue.get(i).start(), target).abs()));
        return indices;
    }

    /**
     * Both intervals are extended by the buffer on their trailing edge before comparing.
     */
    static boolean collides(TimeInterval candidate, List<ScheduledAssignment> placed) {
        TimeInterval buffered = candidate.withTrailing(SchedulingRules.BUFFER);
        for (ScheduledAssignment existing : placed) {
            if (buffered.overlaps(existing.interval().withTrailing(SchedulingRules.BUFFER))) {
                return true;
            }
        }
        return false;
    }
}
