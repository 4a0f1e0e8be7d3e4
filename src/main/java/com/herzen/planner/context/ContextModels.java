package com.herzen.planner.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class ContextModels {
    public record EducationalContext(PrimaryContext primaryContext,
                                     Set<SecondaryContext> secondaryContexts,
                                     LearningStyle learningStyle,
                                     CognitiveLoad cognitiveLoad,
                                     AccessibilityNeeds accessibilityNeeds,
                                     SocialContext socialContext,
                                     TechnologyLevel technologyLevel,
                                     LanguagePreferences languagePreferences,
                                     CulturalContext culturalContext) {}

    public record CognitiveLoad(CognitiveLoadLevel level, LoadFactors factors, List<String> recommendations) {}

    public record LoadFactors(double complexity, double priorKnowledge, double workingMemory, double processingSpeed) {
        public double average() {
            return (complexity + priorKnowledge + workingMemory + processingSpeed) / 4.0;
        }
    }

    public record AccessibilityNeeds(Set<AccessibilityNeed> primary,
                                     Severity severity,
                                     Set<String> assistiveTechnology,
                                     Set<String> accommodations) {}

    public record SocialContext(int groupSize,
                                String interactionType,
                                boolean collaboration,
                                boolean peerLearning,
                                boolean mentoring,
                                boolean competition) {}

    public record TechnologyLevel(String deviceType,
                                  String browser,
                                  String os,
                                  String connectionSpeed,
                                  String technicalComfort,
                                  List<String> availableFeatures) {}

    public record LanguagePreferences(String primary, String secondary, String fluency, boolean translation, boolean bilingual) {}

    public record CulturalContext(String geographic, String cultural, String timezone, List<String> holidays, String educational) {}

    public enum PrimaryContext {
        K12("elementary", "middle", "high"),
        UNIVERSITY("undergraduate", "graduate", "doctoral"),
        PROFESSIONAL("certification", "training", "continuing"),
        VOCATIONAL("trade", "technical", "skill");

        private final List<String> educationLevels;

        PrimaryContext(String... educationLevels) {
            this.educationLevels = List.of(educationLevels);
        }

        public List<String> educationLevels() {
            return educationLevels;
        }

        public static Optional<PrimaryContext> fromName(String name) {
            if (name == null) return Optional.empty();
            return Arrays.stream(values()).filter(c -> c.name().equalsIgnoreCase(name.trim())).findFirst();
        }
    }

    public enum SecondaryContext {
        SPECIAL_NEEDS(RequestSignals.SPECIAL_NEEDS),
        GIFTED_TALENTED(RequestSignals.GIFTED),
        ENGLISH_LANGUAGE_LEARNER(RequestSignals.ESL),
        REMOTE_LEARNING(RequestSignals.REMOTE),
        BLENDED_LEARNING(RequestSignals.BLENDED);

        private final String signal;

        SecondaryContext(String signal) {
            this.signal = signal;
        }

        public String signal() {
            return signal;
        }
    }

    public enum LearningStyle {
        VISUAL, AUDITORY, KINESTHETIC, READING, MIXED;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isConcrete() {
            return this != MIXED;
        }

        public static Optional<LearningStyle> fromLabel(String label) {
            if (label == null) return Optional.empty();
            return Arrays.stream(values()).filter(s -> s.label().equalsIgnoreCase(label.trim())).findFirst();
        }
    }

    public enum CognitiveLoadLevel {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static CognitiveLoadLevel of(double averageLoad) {
            if (averageLoad < 0.4) return LOW;
            if (averageLoad < 0.7) return MEDIUM;
            return HIGH;
        }
    }

    public enum AccessibilityNeed {
        VISUAL(RequestSignals.VISUAL_IMPAIRMENT,
                List.of("screen-reader", "braille-display", "magnifier"),
                List.of("High contrast mode", "Large fonts", "Audio descriptions")),
        HEARING(RequestSignals.HEARING_IMPAIRMENT,
                List.of("hearing-aids", "captions", "sign-language"),
                List.of("Captions", "Sign language", "Visual alerts")),
        MOTOR(RequestSignals.MOTOR_IMPAIRMENT,
                List.of("switch-control", "eye-tracking", "voice-control"),
                List.of("Voice control", "Alternative input methods", "Extended time")),
        COGNITIVE(RequestSignals.COGNITIVE_IMPAIRMENT,
                List.of("memory-aids", "organization-tools", "simplified-ui"),
                List.of("Simplified language", "Memory aids", "Step-by-step guidance"));

        private final String signal;
        private final List<String> assistiveTechnology;
        private final List<String> accommodations;

        AccessibilityNeed(String signal, List<String> assistiveTechnology, List<String> accommodations) {
            this.signal = signal;
            this.assistiveTechnology = assistiveTechnology;
            this.accommodations = accommodations;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public String signal() {
            return signal;
        }

        public List<String> assistiveTechnology() {
            return assistiveTechnology;
        }

        public List<String> accommodations() {
            return accommodations;
        }

        public static Optional<AccessibilityNeed> fromLabel(String label) {
            if (label == null) return Optional.empty();
            return Arrays.stream(values()).filter(n -> n.label().equalsIgnoreCase(label.trim())).findFirst();
        }
    }

    public enum Severity {
        NONE, MILD, MODERATE, SEVERE;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Severity of(int needCount) {
            if (needCount == 0) return NONE;
            if (needCount <= 2) return MILD;
            if (needCount <= 4) return MODERATE;
            return SEVERE;
        }
    }
}
