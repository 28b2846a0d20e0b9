package com.example.studyplanner.planner.web;

import com.example.studyplanner.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/planner")
public class PlannerController {

    private final StudyPlanService planService;

    public PlannerController(StudyPlanService planService) {
        this.planService = planService;
    }

    @PostMapping("/schedule")
    public ResponseEntity<ApiResponse<PlanResponse>> schedule(@Valid @RequestBody PlanRequest request) {
        PlanResponse response = planService.plan(request);
        Map<String, Object> meta = new HashMap<>();
        meta.put("scheduledCount", response.events().size());
        meta.put("unscheduledCount", response.unscheduled().size());
        meta.put("freeSlotCount", response.freeSlotCount());
        return ResponseEntity.ok(ApiResponse.success(response.message(), response, meta));
    }

    // Free time over the horizon, for calendar rendering
    @PostMapping("/free-slots")
    public ResponseEntity<ApiResponse<List<FreeSlotDto>>> freeSlots(
            @RequestBody(required = false) List<BusyEventPayload> busyEvents,
            @RequestParam(name = "horizonDays", required = false) Integer horizonDays) {
        List<FreeSlotDto> data = planService.freeSlots(busyEvents, horizonDays).stream()
                .map(FreeSlotDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Free slots", data, Map.of("count", data.size())));
    }
}
