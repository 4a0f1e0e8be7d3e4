package com.herzen.planner.validation;

import com.herzen.planner.path.PacingCalculator;
import com.herzen.planner.path.PathModels.DifficultyProgression;
import com.herzen.planner.path.PathModels.PathRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class PlanningInputValidator {
    private static final Set<Integer> REVIEW_FREQUENCY_DAYS = Set.of(2, 3, 5);

    public List<Violation> validate(PathRequest request) {
        List<Violation> errors = new ArrayList<>();
        if (request == null) {
            errors.add(new Violation("MISSING_REQUEST", "Path request is required", "request"));
            return errors;
        }

        if (request.profile() == null) {
            errors.add(new Violation("MISSING_PROFILE", "Learner profile is required", "profile"));
        }

        if (request.objectives() == null || request.objectives().isEmpty()) {
            errors.add(new Violation("NO_OBJECTIVES", "At least one learning objective is required", "objectives"));
        } else {
            for (int i = 0; i < request.objectives().size(); i++) {
                String objective = request.objectives().get(i);
                if (objective == null || objective.isBlank()) {
                    errors.add(new Violation("BLANK_OBJECTIVE", "Objective #" + i + " is blank", "objectives[" + i + "]"));
                }
            }
        }

        double pacing = request.optimalPacing();
        if (Double.isNaN(pacing) || Double.isInfinite(pacing) || pacing <= 0) {
            errors.add(new Violation("INVALID_PACING", "Optimal pacing must be a positive number: " + pacing, "optimalPacing"));
        }

        DifficultyProgression progression = request.difficultyProgression();
        if (progression == null) {
            errors.add(new Violation("MISSING_PROGRESSION", "Difficulty progression is required", "difficultyProgression"));
        } else {
            if (progression.initialDifficulty() < 1 || progression.initialDifficulty() > 5) {
                errors.add(new Violation("INVALID_PROGRESSION", "Initial difficulty must be within 1..5: " + progression.initialDifficulty(),
                        "difficultyProgression.initialDifficulty"));
            }
            double rate = progression.progressionRate();
            if (Double.isNaN(rate) || Double.isInfinite(rate) || rate <= 0) {
                errors.add(new Violation("INVALID_PROGRESSION", "Progression rate must be a positive number: " + rate,
                        "difficultyProgression.progressionRate"));
            }
            if (Math.abs(progression.masteryThreshold() - PacingCalculator.MASTERY_THRESHOLD) > 1e-9) {
                errors.add(new Violation("INVALID_PROGRESSION", "Mastery threshold is fixed at " + PacingCalculator.MASTERY_THRESHOLD,
                        "difficultyProgression.masteryThreshold"));
            }
            if (!REVIEW_FREQUENCY_DAYS.contains(progression.reviewFrequencyDays())) {
                errors.add(new Violation("INVALID_PROGRESSION", "Review frequency must be one of " + REVIEW_FREQUENCY_DAYS + " days",
                        "difficultyProgression.reviewFrequencyDays"));
            }
        }

        return errors;
    }

    public void requireValid(PathRequest request) {
        List<Violation> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new InvalidInputException(errors);
        }
    }

    public record Violation(String code, String message, String field) {}
}
