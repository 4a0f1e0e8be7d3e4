package com.herzen.planner;

import com.herzen.planner.context.ContextModels;
import com.herzen.planner.context.EducationalContextAnalyzer;
import com.herzen.planner.domain.DomainModels.*;
import com.herzen.planner.repository.LearningPathJdbcRepository;
import com.herzen.planner.service.LearningPlanService;
import com.herzen.planner.validation.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
class LearningPlanServiceTest {
    @Autowired
    private LearningPlanService planService;
    @Autowired
    private LearningPathJdbcRepository repository;
    @SpyBean
    private EducationalContextAnalyzer contextAnalyzer;

    @Test
    void generatesPlanAndRecordsItInPlanLog() {
        var profile = new LearnerProfile("st-plan-1", 10, "elementary", "advanced",
                new CognitiveCharacteristics(1.0, 0.6, 1.0), new NeurologicalFactors(false),
                null, new LearningPreferences("visual", null), 0.4, List.of("hearing"),
                null, null, null, null, null, null);

        var plan = planService.generatePlan(Map.of("remote", "true"), profile,
                List.of("Fractions", "Decimals", "Team discussion with peer group review"),
                new CurrentProgress(Set.of("Fractions"), 30));

        assertEquals(ContextModels.PrimaryContext.K12, plan.context().primaryContext());
        assertEquals(ContextModels.LearningStyle.VISUAL, plan.context().learningStyle());
        assertEquals(12.8, plan.path().pacingAdjustment(), 1e-9);
        assertEquals(Math.round(3 * 60 / 12.8 * 1.3), plan.path().totalEstimatedTime());
        assertEquals(3, plan.path().checkpoints().size());
        assertTrue(plan.path().checkpoints().get(0).completed());
        assertEquals(1, plan.path().collaborationOpportunities().size());
        assertEquals(4, plan.path().difficultyProgression().initialDifficulty());

        var logged = planService.recentPlans("st-plan-1", null);
        assertEquals(1, logged.size());
        assertEquals(plan.path().pathId(), logged.get(0).pathId());
        assertEquals("K12", logged.get(0).primaryContext());
        assertEquals("visual", logged.get(0).learningStyle());
        assertEquals("accelerated,alternative", logged.get(0).eligibleFallbacks());
        assertTrue(plan.path().pathId().startsWith("path_"));
    }

    @Test
    void recentPlansAreNewestFirst() {
        var profile = new LearnerProfile("st-plan-2", 22, "graduate", null, null, null, null, null, null, null,
                null, null, null, null, null, null);
        var first = planService.generatePlan(Map.of(), profile, List.of("Proofs"), null);
        var second = planService.generatePlan(Map.of(), profile, List.of("Proofs", "Lemmas"), null);

        var logged = planService.recentPlans("st-plan-2", 5);
        assertEquals(List.of(second.path().pathId(), first.path().pathId()),
                logged.stream().map(LearningPathJdbcRepository.PlanLogRow::pathId).toList());
        assertEquals("UNIVERSITY", logged.get(0).primaryContext());
    }

    @Test
    void rejectedRequestLeavesNoPlanLogRow() {
        var profile = new LearnerProfile("st-plan-3", 12, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);

        assertThrows(InvalidInputException.class, () -> planService.generatePlan(Map.of(), profile, List.of(), null));
        assertThrows(InvalidInputException.class, () -> planService.generatePlan(Map.of(), null, List.of("x"), null));
        assertEquals(0, repository.planCount("st-plan-3"));
        verify(contextAnalyzer, never()).analyze(any(), any());
    }

    @Test
    void zeroProcessingSpeedStillYieldsPlan() {
        var profile = new LearnerProfile("st-plan-4", 10, null, null,
                new CognitiveCharacteristics(1.0, 0.5, 0.0), null, null, null, null, null,
                null, null, null, null, null, null);

        var plan = planService.generatePlan(Map.of(), profile, List.of("Fractions"), null);

        assertEquals(12.8, plan.path().pacingAdjustment(), 1e-9);
        assertTrue(plan.path().totalEstimatedTime() > 0);
        assertEquals(1, repository.planCount("st-plan-4"));
    }
}
