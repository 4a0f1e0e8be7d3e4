package com.herzen.planner.domain;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class DomainModels {
    public record LearnerProfile(String learnerId,
                                 Integer age,
                                 String educationLevel,
                                 String knowledgeLevel,
                                 CognitiveCharacteristics cognitiveCharacteristics,
                                 NeurologicalFactors neurologicalFactors,
                                 LearningCharacteristics learningCharacteristics,
                                 LearningPreferences learningPreferences,
                                 Double priorKnowledge,
                                 List<String> accessibilityNeeds,
                                 LanguageProfile language,
                                 String location,
                                 String timezone,
                                 CulturalProfile cultural,
                                 String technologyComfort,
                                 Map<String, Double> contentPreferences) {}

    public record CognitiveCharacteristics(Double attention, Double workingMemory, Double processingSpeed) {}

    public record NeurologicalFactors(boolean adhd) {}

    public record LearningCharacteristics(Double speed, Double retention) {}

    public record LearningPreferences(String style, Map<String, Double> resourceTypes) {}

    public record LanguageProfile(String primary, String secondary, String fluency) {}

    public record CulturalProfile(String background, List<String> holidays, String educationalValues) {}

    public record CurrentProgress(Set<String> completedObjectives, long timeSpentMinutes) {
        public static CurrentProgress empty() {
            return new CurrentProgress(Set.of(), 0);
        }

        public boolean isCompleted(String objective) {
            return completedObjectives != null && completedObjectives.contains(objective);
        }
    }
}
