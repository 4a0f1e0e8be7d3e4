package com.herzen.planner.service;

import com.herzen.planner.config.PlanningProperties;
import com.herzen.planner.context.ContextModels.EducationalContext;
import com.herzen.planner.context.EducationalContextAnalyzer;
import com.herzen.planner.domain.DomainModels.CurrentProgress;
import com.herzen.planner.domain.DomainModels.LearnerProfile;
import com.herzen.planner.path.LearningPathOptimizer;
import com.herzen.planner.path.PacingCalculator;
import com.herzen.planner.path.PathModels.FallbackPath;
import com.herzen.planner.path.PathModels.LearningPath;
import com.herzen.planner.path.PathModels.PathRequest;
import com.herzen.planner.path.PathModels.ResourceKind;
import com.herzen.planner.repository.LearningPathJdbcRepository;
import com.herzen.planner.repository.LearningPathJdbcRepository.PlanLogRow;
import com.herzen.planner.validation.PlanningInputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class LearningPlanService {
    private static final Logger log = LoggerFactory.getLogger(LearningPlanService.class);

    private final EducationalContextAnalyzer contextAnalyzer;
    private final PacingCalculator pacingCalculator;
    private final LearningPathOptimizer pathOptimizer;
    private final PlanningInputValidator validator;
    private final LearningPathJdbcRepository repository;
    private final PlanningProperties properties;

    public LearningPlanService(EducationalContextAnalyzer contextAnalyzer,
                               PacingCalculator pacingCalculator,
                               LearningPathOptimizer pathOptimizer,
                               PlanningInputValidator validator,
                               LearningPathJdbcRepository repository,
                               PlanningProperties properties) {
        this.contextAnalyzer = contextAnalyzer;
        this.pacingCalculator = pacingCalculator;
        this.pathOptimizer = pathOptimizer;
        this.validator = validator;
        this.repository = repository;
        this.properties = properties;
    }

    public EducationalContext analyzeContext(Map<String, String> signals, LearnerProfile profile) {
        return contextAnalyzer.analyze(signals, profile);
    }

    public LearningPlan generatePlan(Map<String, String> signals,
                                     LearnerProfile profile,
                                     List<String> objectives,
                                     CurrentProgress progress) {
        PathRequest request = new PathRequest(profile, objectives, progress,
                EnumSet.allOf(ResourceKind.class),
                pacingCalculator.optimalPacing(profile),
                pacingCalculator.difficultyProgression(profile));
        validator.requireValid(request);

        EducationalContext context = contextAnalyzer.analyze(signals, profile);
        LearningPath path = pathOptimizer.createPath(request);

        log.info("Generated learning path {} for learner {}: {} checkpoints, {} min, pacing {}",
                path.pathId(), learnerId(profile), path.checkpoints().size(), path.totalEstimatedTime(),
                path.pacingAdjustment());

        if (properties.auditLogEnabled()) {
            repository.savePlanLog(new PlanLogRow(
                    path.pathId(),
                    learnerId(profile),
                    context.primaryContext().name(),
                    context.learningStyle().label(),
                    path.checkpoints().size(),
                    path.totalEstimatedTime(),
                    path.eligibleFallbackPaths().stream().map(FallbackPath::name).collect(Collectors.joining(",")),
                    Instant.now()));
        }
        return new LearningPlan(context, path);
    }

    public List<PlanLogRow> recentPlans(String learnerId, Integer limit) {
        int effective = (limit == null || limit <= 0) ? properties.recentPlansLimit() : Math.min(limit, properties.recentPlansLimit());
        return repository.loadPlanLog(learnerId, effective);
    }

    private String learnerId(LearnerProfile profile) {
        return profile == null ? null : profile.learnerId();
    }

    public record LearningPlan(EducationalContext context, LearningPath path) {}
}
