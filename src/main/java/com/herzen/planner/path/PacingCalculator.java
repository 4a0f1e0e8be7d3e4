package com.herzen.planner.path;

import com.herzen.planner.domain.DomainModels.CognitiveCharacteristics;
import com.herzen.planner.domain.DomainModels.LearnerProfile;
import com.herzen.planner.domain.DomainModels.LearningCharacteristics;
import com.herzen.planner.path.PathModels.DifficultyProgression;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
public class PacingCalculator {
    public static final double MASTERY_THRESHOLD = 0.85;

    private static final double BASE_ATTENTION_SPAN_MINUTES = 20.0;
    private static final double MAX_ATTENTION_SPAN_MINUTES = 45.0;
    private static final double ADHD_FACTOR = 0.7;
    private static final double DEFAULT_RETENTION = 0.8;

    private static final Map<String, Integer> DIFFICULTY_BY_KNOWLEDGE_LEVEL = Map.of(
            "novice", 1,
            "beginner", 2,
            "intermediate", 3,
            "advanced", 4,
            "expert", 5
    );

    public double ageFactor(Integer age) {
        // unknown age falls through to the adult bracket
        if (age == null) return 1.4;
        if (age < 8) return 0.6;
        if (age < 12) return 0.8;
        if (age < 16) return 1.0;
        if (age < 20) return 1.2;
        return 1.4;
    }

    public double attentionSpanMinutes(LearnerProfile profile) {
        double ageFactor = ageFactor(profile == null ? null : profile.age());
        double attention = positiveOrDefault(cognitive(profile) == null ? null : cognitive(profile).attention(), 1.0);
        boolean adhd = profile != null && profile.neurologicalFactors() != null && profile.neurologicalFactors().adhd();
        double adhdFactor = adhd ? ADHD_FACTOR : 1.0;
        return Math.min(BASE_ATTENTION_SPAN_MINUTES * ageFactor * attention * adhdFactor, MAX_ATTENTION_SPAN_MINUTES);
    }

    public double optimalPacing(LearnerProfile profile) {
        double ageFactor = ageFactor(profile == null ? null : profile.age());
        double processingSpeed = positiveOrDefault(cognitive(profile) == null ? null : cognitive(profile).processingSpeed(), 1.0);
        return ageFactor * attentionSpanMinutes(profile) * processingSpeed;
    }

    public DifficultyProgression difficultyProgression(LearnerProfile profile) {
        LearningCharacteristics learning = profile == null ? null : profile.learningCharacteristics();
        double speed = orDefault(learning == null ? null : learning.speed(), 1.0);
        double retention = orDefault(learning == null ? null : learning.retention(), DEFAULT_RETENTION);

        double rate = speed * retention;
        if (!(rate > 0) || Double.isInfinite(rate)) {
            rate = DEFAULT_RETENTION;
        }

        return new DifficultyProgression(
                initialDifficulty(profile == null ? null : profile.knowledgeLevel()),
                rate,
                MASTERY_THRESHOLD,
                reviewFrequencyDays(speed));
    }

    int initialDifficulty(String knowledgeLevel) {
        if (knowledgeLevel == null) return 2;
        return DIFFICULTY_BY_KNOWLEDGE_LEVEL.getOrDefault(knowledgeLevel.trim().toLowerCase(Locale.ROOT), 2);
    }

    int reviewFrequencyDays(double learningRate) {
        if (learningRate < 0.7) return 2;
        if (learningRate < 0.9) return 3;
        return 5;
    }

    private CognitiveCharacteristics cognitive(LearnerProfile profile) {
        return profile == null ? null : profile.cognitiveCharacteristics();
    }

    private double orDefault(Double value, double fallback) {
        return (value == null || value.isNaN()) ? fallback : value;
    }

    // pacing divides the path duration, so only a finite positive factor is usable
    private double positiveOrDefault(Double value, double fallback) {
        return (value == null || !(value > 0) || value.isInfinite()) ? fallback : value;
    }
}
