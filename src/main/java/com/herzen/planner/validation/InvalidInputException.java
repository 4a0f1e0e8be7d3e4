package com.herzen.planner.validation;

import java.util.List;

public class InvalidInputException extends RuntimeException {
    public static final String USER_MESSAGE = "insufficient information to build a learning plan";

    private final List<PlanningInputValidator.Violation> violations;

    public InvalidInputException(List<PlanningInputValidator.Violation> violations) {
        super(USER_MESSAGE);
        this.violations = List.copyOf(violations);
    }

    public List<PlanningInputValidator.Violation> violations() {
        return violations;
    }
}
