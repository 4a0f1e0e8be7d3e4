package com.herzen.planner;

import com.herzen.planner.context.CognitiveAccessibilityScorer;
import com.herzen.planner.context.ContextModels.*;
import com.herzen.planner.context.EducationalContextAnalyzer;
import com.herzen.planner.domain.DomainModels.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EducationalContextAnalyzerTest {
    private final EducationalContextAnalyzer analyzer = new EducationalContextAnalyzer(new CognitiveAccessibilityScorer());

    @Test
    void explicitContextSignalWinsOverPathAndProfile() {
        var context = analyzer.analyze(
                Map.of("context", "VOCATIONAL", "path", "/learn/university/math"),
                profile(p -> p.educationLevel = "graduate"));
        assertEquals(PrimaryContext.VOCATIONAL, context.primaryContext());
    }

    @Test
    void pathSegmentWinsOverProfileEducationLevel() {
        var context = analyzer.analyze(Map.of("path", "/courses/professional/safety"), profile(p -> p.educationLevel = "graduate"));
        assertEquals(PrimaryContext.PROFESSIONAL, context.primaryContext());
    }

    @Test
    void unknownExplicitContextFallsThroughToProfile() {
        var context = analyzer.analyze(Map.of("context", "KINDERGARTEN", "path", "/courses/professionals"), profile(p -> p.educationLevel = "graduate"));
        assertEquals(PrimaryContext.UNIVERSITY, context.primaryContext());
    }

    @Test
    void defaultsEverythingWithoutSignalsOrProfile() {
        var context = analyzer.analyze(null, null);
        assertEquals(PrimaryContext.K12, context.primaryContext());
        assertTrue(context.secondaryContexts().isEmpty());
        assertEquals(LearningStyle.MIXED, context.learningStyle());
        assertEquals(CognitiveLoadLevel.MEDIUM, context.cognitiveLoad().level());
        assertEquals(Severity.NONE, context.accessibilityNeeds().severity());
        assertEquals(1, context.socialContext().groupSize());
        assertEquals("individual", context.socialContext().interactionType());
        assertEquals("en", context.languagePreferences().primary());
        assertFalse(context.languagePreferences().bilingual());
        assertEquals("UTC", context.culturalContext().timezone());
        assertEquals("unknown", context.culturalContext().geographic());
        assertEquals("desktop", context.technologyLevel().deviceType());
    }

    @Test
    void collectsSecondaryContextsFromFlags() {
        var context = analyzer.analyze(Map.of("esl", "true", "remote", "TRUE", "gifted", "false", "blended", "yes"), null);
        assertEquals(Set.of(SecondaryContext.ENGLISH_LANGUAGE_LEARNER, SecondaryContext.REMOTE_LEARNING), context.secondaryContexts());
    }

    @Test
    void learningStyleFollowsSignalThenProfileThenBehaviour() {
        var profile = profile(p -> {
            p.style = "auditory";
            p.contentPreferences = Map.of("kinesthetic", 0.9, "visual", 0.2);
        });
        assertEquals(LearningStyle.VISUAL, analyzer.analyze(Map.of("learning-style", "visual"), profile).learningStyle());
        assertEquals(LearningStyle.AUDITORY, analyzer.analyze(Map.of(), profile).learningStyle());

        var behaviourOnly = profile(p -> p.contentPreferences = Map.of("kinesthetic", 0.9, "visual", 0.2, "reading", 0.4));
        assertEquals(LearningStyle.KINESTHETIC, analyzer.analyze(Map.of(), behaviourOnly).learningStyle());

        var emptyHistory = profile(p -> p.contentPreferences = Map.of());
        assertEquals(LearningStyle.MIXED, analyzer.analyze(Map.of(), emptyHistory).learningStyle());
    }

    @Test
    void cognitiveLoadFiresIndependentRecommendationsAndClampsFactors() {
        var profile = profile(p -> {
            p.priorKnowledge = 0.1;
            p.cognitive = new CognitiveCharacteristics(null, 0.2, 3.0);
        });
        var load = analyzer.analyze(Map.of("complexity", "0.9"), profile).cognitiveLoad();

        assertEquals(1.0, load.factors().processingSpeed());
        assertEquals(0.9, load.factors().complexity(), 1e-9);
        assertEquals(CognitiveLoadLevel.MEDIUM, load.level());
        assertEquals(List.of("Reduce content complexity", "Break information into smaller chunks", "Provide more background information"),
                load.recommendations());
    }

    @Test
    void cognitiveLoadLevelsFollowAverageThresholds() {
        var low = profile(p -> {
            p.priorKnowledge = 0.3;
            p.cognitive = new CognitiveCharacteristics(null, 0.4, 0.3);
        });
        assertEquals(CognitiveLoadLevel.LOW, analyzer.analyze(Map.of("complexity", "0.2"), low).cognitiveLoad().level());

        var high = profile(p -> {
            p.priorKnowledge = 0.8;
            p.cognitive = new CognitiveCharacteristics(null, 0.7, 0.7);
        });
        assertEquals(CognitiveLoadLevel.HIGH, analyzer.analyze(Map.of("complexity", "0.7"), high).cognitiveLoad().level());

        var garbage = analyzer.analyze(Map.of("complexity", "very"), null).cognitiveLoad();
        assertEquals(0.5, garbage.factors().complexity());
    }

    @Test
    void accessibilityNeedsAreDeduplicatedAndTableDriven() {
        var profile = profile(p -> p.accessibilityNeeds = List.of("hearing", "motor", "visual", "telepathic"));
        var needs = analyzer.analyze(Map.of("visual-impairment", "true"), profile).accessibilityNeeds();

        assertEquals(List.of(AccessibilityNeed.VISUAL, AccessibilityNeed.HEARING, AccessibilityNeed.MOTOR), List.copyOf(needs.primary()));
        assertEquals(Severity.MODERATE, needs.severity());
        assertEquals(List.of("screen-reader", "braille-display", "magnifier",
                        "hearing-aids", "captions", "sign-language",
                        "switch-control", "eye-tracking", "voice-control"),
                List.copyOf(needs.assistiveTechnology()));
        assertTrue(needs.accommodations().containsAll(Set.of("Captions", "Extended time", "Large fonts")));
        assertEquals(9, needs.accommodations().size());
    }

    @Test
    void twoNeedsAreMild() {
        var needs = analyzer.analyze(Map.of("cognitive-impairment", "true"), profile(p -> p.accessibilityNeeds = List.of("cognitive", "motor"))).accessibilityNeeds();
        assertEquals(2, needs.primary().size());
        assertEquals(Severity.MILD, needs.severity());
    }

    @Test
    void readsTechnologySocialLanguageAndCulturalSignals() {
        var profile = profile(p -> {
            p.language = new LanguageProfile("ru", "en", "fluent");
            p.cultural = new CulturalProfile("slavic", List.of("new-year"), null);
            p.location = "Saint Petersburg";
        });
        var context = analyzer.analyze(Map.of(
                "user-agent", "Mozilla/5.0 (Linux; Android 14) AppleWebKit/537.36 Chrome/124.0 Mobile Safari/537.36",
                "connection-speed", "slow",
                "group-size", "5",
                "collaboration", "true",
                "timezone", "Europe/Moscow"), profile);

        assertEquals("mobile", context.technologyLevel().deviceType());
        assertEquals("Chrome", context.technologyLevel().browser());
        assertEquals("Linux", context.technologyLevel().os());
        assertTrue(context.technologyLevel().availableFeatures().containsAll(List.of("touch-interface", "low-bandwidth-mode")));
        assertEquals(5, context.socialContext().groupSize());
        assertTrue(context.socialContext().collaboration());
        assertEquals("ru", context.languagePreferences().primary());
        assertTrue(context.languagePreferences().bilingual());
        assertEquals("Saint Petersburg", context.culturalContext().geographic());
        assertEquals("Europe/Moscow", context.culturalContext().timezone());
        assertEquals("universal", context.culturalContext().educational());
    }

    @Test
    void repeatedAnalysisIsIdentical() {
        var profile = profile(p -> {
            p.educationLevel = "trade";
            p.accessibilityNeeds = List.of("visual");
            p.contentPreferences = Map.of("reading", 0.6, "auditory", 0.6);
        });
        Map<String, String> signals = Map.of("complexity", "0.65", "esl", "true");
        assertEquals(analyzer.analyze(signals, profile), analyzer.analyze(signals, profile));
        assertEquals(LearningStyle.AUDITORY, analyzer.analyze(signals, profile).learningStyle());
    }

    private static LearnerProfile profile(java.util.function.Consumer<ProfileBuilder> customizer) {
        ProfileBuilder b = new ProfileBuilder();
        customizer.accept(b);
        return b.build();
    }

    static class ProfileBuilder {
        String educationLevel;
        String style;
        Double priorKnowledge;
        CognitiveCharacteristics cognitive;
        List<String> accessibilityNeeds;
        LanguageProfile language;
        CulturalProfile cultural;
        String location;
        Map<String, Double> contentPreferences;

        LearnerProfile build() {
            return new LearnerProfile("learner-1", 14, educationLevel, null, cognitive, null, null,
                    style == null ? null : new LearningPreferences(style, null),
                    priorKnowledge, accessibilityNeeds, language, location, null, cultural, null, contentPreferences);
        }
    }
}
