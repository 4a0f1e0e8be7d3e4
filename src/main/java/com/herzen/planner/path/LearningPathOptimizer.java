package com.herzen.planner.path;

import com.herzen.planner.context.ContextModels.LearningStyle;
import com.herzen.planner.domain.DomainModels.CurrentProgress;
import com.herzen.planner.domain.DomainModels.LearnerProfile;
import com.herzen.planner.path.PathModels.*;
import com.herzen.planner.validation.PlanningInputValidator;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class LearningPathOptimizer {
    static final int BASE_MINUTES_PER_OBJECTIVE = 60;
    static final double BREAK_BUFFER = 1.3;
    static final int BASE_CHECKPOINT_MINUTES = 45;

    private static final Map<LearningStyle, Map<ResourceKind, Double>> PRIORITY_BY_STYLE = Map.of(
            LearningStyle.VISUAL, Map.of(ResourceKind.TEXT, 0.3, ResourceKind.VIDEO, 0.4, ResourceKind.INTERACTIVE, 0.2, ResourceKind.SIMULATION, 0.1),
            LearningStyle.AUDITORY, Map.of(ResourceKind.TEXT, 0.2, ResourceKind.VIDEO, 0.5, ResourceKind.INTERACTIVE, 0.2, ResourceKind.SIMULATION, 0.1),
            LearningStyle.KINESTHETIC, Map.of(ResourceKind.TEXT, 0.2, ResourceKind.VIDEO, 0.2, ResourceKind.INTERACTIVE, 0.4, ResourceKind.SIMULATION, 0.2)
    );
    private static final double DEFAULT_PRIORITY = 0.25;

    private static final Map<LearningStyle, String> RESOURCE_SHIFT_BY_STYLE = Map.of(
            LearningStyle.VISUAL, "increase visual resources",
            LearningStyle.AUDITORY, "increase audio content",
            LearningStyle.KINESTHETIC, "increase interactive elements",
            LearningStyle.READING, "increase text resources",
            LearningStyle.MIXED, "keep current resource mix"
    );

    private static final List<ReinforcementStage> REINFORCEMENT_SCHEDULE = List.of(
            new ReinforcementStage("immediate", 0, List.of("summary", "key-points", "quick-quiz")),
            new ReinforcementStage("short-term", 1, List.of("review-notes", "practice-exercises", "peer-discussion")),
            new ReinforcementStage("medium-term", 7, List.of("application-project", "real-world-example", "teaching-others")),
            new ReinforcementStage("long-term", 30, List.of("comprehensive-review", "advanced-application", "reflection"))
    );

    private final PlanningInputValidator validator;
    private final CollaborationMatcher collaborationMatcher;
    private final PathIdGenerator pathIdGenerator;

    public LearningPathOptimizer(PlanningInputValidator validator,
                                 CollaborationMatcher collaborationMatcher,
                                 PathIdGenerator pathIdGenerator) {
        this.validator = validator;
        this.collaborationMatcher = collaborationMatcher;
        this.pathIdGenerator = pathIdGenerator;
    }

    public LearningPath createPath(PathRequest request) {
        validator.requireValid(request);

        LearnerProfile profile = request.profile();
        List<String> objectives = List.copyOf(request.objectives());
        CurrentProgress progress = request.currentProgress() == null ? CurrentProgress.empty() : request.currentProgress();
        Set<ResourceKind> resources = (request.availableResources() == null || request.availableResources().isEmpty())
                ? EnumSet.allOf(ResourceKind.class)
                : EnumSet.copyOf(request.availableResources());
        LearningStyle style = preferredStyle(profile);

        return new LearningPath(
                pathIdGenerator.nextId(),
                totalEstimatedTime(objectives.size(), request.optimalPacing()),
                request.difficultyProgression(),
                checkpoints(objectives, request.difficultyProgression(), progress),
                allocateResources(resources, profile, style),
                request.optimalPacing(),
                assessmentStrategy(profile, objectives),
                REINFORCEMENT_SCHEDULE,
                adaptivityRules(style),
                collaborationMatcher.opportunities(objectives),
                fallbackPaths(profile, style));
    }

    int totalEstimatedTime(int objectiveCount, double optimalPacing) {
        double minutes = objectiveCount * BASE_MINUTES_PER_OBJECTIVE / optimalPacing * BREAK_BUFFER;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, Math.round(minutes)));
    }

    List<Checkpoint> checkpoints(List<String> objectives, DifficultyProgression progression, CurrentProgress progress) {
        List<Checkpoint> checkpoints = new ArrayList<>(objectives.size());
        for (int i = 0; i < objectives.size(); i++) {
            String objective = objectives.get(i);
            double level = progression.initialDifficulty() + i * progression.progressionRate();
            checkpoints.add(new Checkpoint(
                    "checkpoint_" + i,
                    objective,
                    level,
                    difficultyLabel(level),
                    (int) Math.round(BASE_CHECKPOINT_MINUTES * (double) progression.initialDifficulty()),
                    assessmentType(objective),
                    masteryCriteria(objective),
                    nextStep(i, objectives.size()),
                    progress.isCompleted(objective)));
        }
        return List.copyOf(checkpoints);
    }

    Map<String, ResourceAllocation> allocateResources(Set<ResourceKind> available, LearnerProfile profile, LearningStyle style) {
        Map<String, Double> preferences = profile.learningPreferences() == null || profile.learningPreferences().resourceTypes() == null
                ? Map.of()
                : profile.learningPreferences().resourceTypes();

        Map<ResourceKind, Double> raw = new EnumMap<>(ResourceKind.class);
        for (ResourceKind kind : available) {
            Double preferred = preferences.get(kind.label());
            boolean usable = preferred != null && !preferred.isNaN() && !preferred.isInfinite() && preferred >= 0;
            raw.put(kind, usable ? preferred : kind.basePercentage());
        }

        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        double divisor = total > 1.0 ? total : 1.0;

        Map<String, ResourceAllocation> allocation = new LinkedHashMap<>();
        raw.forEach((kind, pct) -> allocation.put(kind.label(),
                new ResourceAllocation(pct / divisor, priority(kind, style), kind.alternative())));
        return Collections.unmodifiableMap(allocation);
    }

    AssessmentStrategy assessmentStrategy(LearnerProfile profile, List<String> objectives) {
        Double attention = profile.cognitiveCharacteristics() == null ? null : profile.cognitiveCharacteristics().attention();
        double frequency = 0.2 * (attention == null || attention.isNaN() ? 1.0 : attention);

        List<SuccessCriteria> criteria = objectives.stream()
                .map(o -> new SuccessCriteria(o,
                        Map.of("understanding", "explain-concept",
                                "application", "solve-problems",
                                "transfer", "apply-to-new-context"),
                        List.of("basic", "proficient", "advanced")))
                .toList();

        return new AssessmentStrategy(
                new FormativePlan(frequency, List.of("quick-check", "reflection", "self-assessment"), true),
                new SummativePlan("per-objective", List.of("project", "presentation", "quiz"), criteria),
                new DiagnosticPlan(true, true, List.of("pretest", "learning-style-assessment", "knowledge-check")));
    }

    List<AdaptivityRule> adaptivityRules(LearningStyle style) {
        String shift = RESOURCE_SHIFT_BY_STYLE.get(style);
        return List.of(
                rule("low-engagement", "engagement", "<", 0.3, Adjustment.MAINTAIN, Adjustment.DECREASE, shift),
                rule("high-difficulty", "difficulty", ">", 0.8, Adjustment.DECREASE, Adjustment.DECREASE, shift),
                rule("rapid-completion", "completion-time-ratio", "<", 0.5, Adjustment.INCREASE, Adjustment.INCREASE, shift),
                rule("slow-progression", "completion-time-ratio", ">", 2.0, Adjustment.DECREASE, Adjustment.DECREASE, shift)
        );
    }

    List<FallbackPath> fallbackPaths(LearnerProfile profile, LearningStyle style) {
        String knowledge = profile.knowledgeLevel() == null ? "" : profile.knowledgeLevel().trim().toLowerCase(Locale.ROOT);
        return List.of(
                new FallbackPath("accelerated", "Fast-track path for advanced learners",
                        "advanced".equals(knowledge),
                        List.of("skip-basics", "focus-applications", "independent-study")),
                new FallbackPath("remedial", "Foundation-building path for struggling learners",
                        "beginner".equals(knowledge),
                        List.of("extra-practice", "scaffolded-learning", "peer-support")),
                new FallbackPath("alternative", "Different modality approach",
                        style == LearningStyle.VISUAL,
                        List.of("visual-focus", "hands-on-activities", "demonstrations"))
        );
    }

    private AdaptivityRule rule(String trigger, String signal, String comparison, double threshold,
                               Adjustment difficulty, Adjustment pacing, String resourceShift) {
        return new AdaptivityRule(trigger, signal, comparison, threshold,
                difficulty, difficultyAdaptation(difficulty), pacing, pacingAdaptation(pacing), resourceShift);
    }

    private String difficultyAdaptation(Adjustment adjustment) {
        return switch (adjustment) {
            case INCREASE -> "add challenge elements, advanced concepts";
            case DECREASE -> "simplify explanations, add scaffolding";
            case MAINTAIN -> "current difficulty level";
        };
    }

    private String pacingAdaptation(Adjustment adjustment) {
        return switch (adjustment) {
            case INCREASE -> "accelerate content delivery";
            case DECREASE -> "slow down, add practice opportunities";
            case MAINTAIN -> "current pacing";
        };
    }

    private double priority(ResourceKind kind, LearningStyle style) {
        Map<ResourceKind, Double> table = PRIORITY_BY_STYLE.get(style);
        return table == null ? DEFAULT_PRIORITY : table.getOrDefault(kind, DEFAULT_PRIORITY);
    }

    private LearningStyle preferredStyle(LearnerProfile profile) {
        if (profile.learningPreferences() == null) return LearningStyle.MIXED;
        return LearningStyle.fromLabel(profile.learningPreferences().style()).orElse(LearningStyle.MIXED);
    }

    private String difficultyLabel(double level) {
        if (level < 2) return "beginner";
        if (level < 3.5) return "intermediate";
        return "advanced";
    }

    private String assessmentType(String objective) {
        String text = objective.toLowerCase(Locale.ROOT);
        if (text.contains("memorization")) return "quiz";
        if (text.contains("application")) return "project";
        if (text.contains("analysis")) return "discussion";
        return "mixed";
    }

    private MasteryCriteria masteryCriteria(String objective) {
        String text = objective.toLowerCase(Locale.ROOT);
        return new MasteryCriteria(
                PacingCalculator.MASTERY_THRESHOLD,
                2,
                text.contains("application") ? 120 : 60,
                text.contains("practical") ? "practical-demonstration" : "theoretical-explanation");
    }

    private String nextStep(int index, int total) {
        if (index == 0) return "introduction";
        if (index == total - 1) return "synthesis";
        return "application";
    }
}
