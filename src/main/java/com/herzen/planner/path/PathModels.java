package com.herzen.planner.path;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.planner.domain.DomainModels.CurrentProgress;
import com.herzen.planner.domain.DomainModels.LearnerProfile;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class PathModels {
    public record PathRequest(LearnerProfile profile,
                              List<String> objectives,
                              CurrentProgress currentProgress,
                              Set<ResourceKind> availableResources,
                              double optimalPacing,
                              DifficultyProgression difficultyProgression) {}

    public record LearningPath(String pathId,
                               int totalEstimatedTime,
                               DifficultyProgression difficultyProgression,
                               List<Checkpoint> checkpoints,
                               Map<String, ResourceAllocation> resourceAllocation,
                               double pacingAdjustment,
                               AssessmentStrategy assessmentStrategy,
                               List<ReinforcementStage> reinforcementSchedule,
                               List<AdaptivityRule> adaptivityRules,
                               List<CollaborationOpportunity> collaborationOpportunities,
                               List<FallbackPath> fallbackPaths) {
        @JsonIgnore
        public List<FallbackPath> eligibleFallbackPaths() {
            return fallbackPaths.stream().filter(FallbackPath::eligible).toList();
        }
    }

    public record DifficultyProgression(int initialDifficulty,
                                        double progressionRate,
                                        double masteryThreshold,
                                        int reviewFrequencyDays) {}

    public record Checkpoint(String checkpointId,
                             String objective,
                             double difficultyLevel,
                             String expectedDifficulty,
                             int estimatedMinutes,
                             String assessmentType,
                             MasteryCriteria masteryCriteria,
                             String nextStep,
                             boolean completed) {}

    public record MasteryCriteria(double score, int attempts, int timeSpentMinutes, String demonstration) {}

    public record ResourceAllocation(double percentage, double priority, String alternative) {}

    public record AssessmentStrategy(FormativePlan formative, SummativePlan summative, DiagnosticPlan diagnostic) {}

    public record FormativePlan(double frequency, List<String> types, boolean adaptive) {}

    public record SummativePlan(String frequency, List<String> types, List<SuccessCriteria> criteria) {}

    public record SuccessCriteria(String objective, Map<String, String> criteria, List<String> levels) {}

    public record DiagnosticPlan(boolean preAssessment, boolean ongoing, List<String> tools) {}

    public record ReinforcementStage(String type, int dayOffset, List<String> activities) {}

    public record AdaptivityRule(String trigger,
                                 String signal,
                                 String comparison,
                                 double threshold,
                                 Adjustment difficulty,
                                 String difficultyAdaptation,
                                 Adjustment pacing,
                                 String pacingAdaptation,
                                 String resourceShift) {}

    public record CollaborationOpportunity(int checkpoint,
                                           String objective,
                                           double opportunity,
                                           List<String> suggestedActivities,
                                           GroupSize groupSize,
                                           List<String> roles) {}

    public record GroupSize(int min, int max) {}

    public record FallbackPath(String name, String description, boolean eligible, List<String> modifications) {}

    public enum Adjustment {
        INCREASE, DECREASE, MAINTAIN;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum ResourceKind {
        TEXT(0.25, "video-summary"),
        VIDEO(0.35, "text-transcript"),
        INTERACTIVE(0.25, "guided-practice"),
        SIMULATION(0.15, "demonstration");

        private final double basePercentage;
        private final String alternative;

        ResourceKind(double basePercentage, String alternative) {
            this.basePercentage = basePercentage;
            this.alternative = alternative;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public double basePercentage() {
            return basePercentage;
        }

        public String alternative() {
            return alternative;
        }
    }
}
