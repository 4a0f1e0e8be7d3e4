package com.herzen.planner.api;

import com.herzen.planner.context.ContextModels;
import com.herzen.planner.domain.DomainModels;
import com.herzen.planner.repository.LearningPathJdbcRepository;
import com.herzen.planner.service.LearningPlanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/planning")
public class PlanningController {
    private final LearningPlanService planService;

    public PlanningController(LearningPlanService planService) {
        this.planService = planService;
    }

    @PostMapping("/context")
    public ResponseEntity<ContextModels.EducationalContext> context(@RequestBody ContextRequest request) {
        return ResponseEntity.ok(planService.analyzeContext(request.signals(), request.profile()));
    }

    @PostMapping("/paths")
    public ResponseEntity<LearningPlanService.LearningPlan> generate(@RequestBody PathRequest request) {
        return ResponseEntity.ok(planService.generatePlan(
                request.signals(), request.profile(), request.objectives(), request.currentProgress()));
    }

    @GetMapping("/paths")
    public ResponseEntity<List<LearningPathJdbcRepository.PlanLogRow>> recent(@RequestParam String learnerId,
                                                                              @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(planService.recentPlans(learnerId, limit));
    }

    public record ContextRequest(Map<String, String> signals, DomainModels.LearnerProfile profile) {}

    public record PathRequest(Map<String, String> signals,
                              DomainModels.LearnerProfile profile,
                              List<String> objectives,
                              DomainModels.CurrentProgress currentProgress) {}
}
