package com.herzen.planner.context;

import com.herzen.planner.context.ContextModels.*;
import com.herzen.planner.domain.DomainModels.CulturalProfile;
import com.herzen.planner.domain.DomainModels.LanguageProfile;
import com.herzen.planner.domain.DomainModels.LearnerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class EducationalContextAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(EducationalContextAnalyzer.class);

    private final CognitiveAccessibilityScorer scorer;

    public EducationalContextAnalyzer(CognitiveAccessibilityScorer scorer) {
        this.scorer = scorer;
    }

    public EducationalContext analyze(Map<String, String> signals, LearnerProfile profile) {
        Map<String, String> safeSignals = signals == null ? Map.of() : signals;
        if (log.isDebugEnabled()) {
            Set<String> unknown = safeSignals.keySet().stream()
                    .filter(k -> !RequestSignals.SUPPORTED.contains(k))
                    .collect(Collectors.toCollection(TreeSet::new));
            if (!unknown.isEmpty()) log.debug("Ignoring unsupported request signals {}", unknown);
        }

        EducationalContext context = new EducationalContext(
                primaryContext(safeSignals, profile),
                secondaryContexts(safeSignals),
                learningStyle(safeSignals, profile),
                scorer.cognitiveLoad(safeSignals, profile),
                scorer.accessibilityNeeds(safeSignals, profile),
                socialContext(safeSignals),
                technologyLevel(safeSignals, profile),
                languagePreferences(safeSignals, profile),
                culturalContext(safeSignals, profile));

        log.debug("Derived context primary={} style={} load={} accessibility={}",
                context.primaryContext(), context.learningStyle().label(),
                context.cognitiveLoad().level().label(), context.accessibilityNeeds().severity().label());
        return context;
    }

    PrimaryContext primaryContext(Map<String, String> signals, LearnerProfile profile) {
        Optional<PrimaryContext> explicit = PrimaryContext.fromName(RequestSignals.value(signals, RequestSignals.CONTEXT));
        if (explicit.isPresent()) return explicit.get();

        String path = RequestSignals.value(signals, RequestSignals.PATH);
        if (path != null) {
            Set<String> segments = Arrays.stream(path.split("/"))
                    .filter(s -> !s.isBlank())
                    .collect(Collectors.toSet());
            for (PrimaryContext candidate : PrimaryContext.values()) {
                if (segments.contains(candidate.name().toLowerCase(Locale.ROOT))) return candidate;
            }
        }

        if (profile != null && profile.educationLevel() != null) {
            String level = profile.educationLevel().trim().toLowerCase(Locale.ROOT);
            for (PrimaryContext candidate : PrimaryContext.values()) {
                if (candidate.educationLevels().contains(level)) return candidate;
            }
        }

        return PrimaryContext.K12;
    }

    Set<SecondaryContext> secondaryContexts(Map<String, String> signals) {
        Set<SecondaryContext> contexts = new LinkedHashSet<>();
        for (SecondaryContext candidate : SecondaryContext.values()) {
            if (RequestSignals.flag(signals, candidate.signal())) contexts.add(candidate);
        }
        return Collections.unmodifiableSet(contexts);
    }

    LearningStyle learningStyle(Map<String, String> signals, LearnerProfile profile) {
        Optional<LearningStyle> explicit = LearningStyle.fromLabel(RequestSignals.value(signals, RequestSignals.LEARNING_STYLE))
                .filter(LearningStyle::isConcrete);
        if (explicit.isPresent()) return explicit.get();

        if (profile != null && profile.learningPreferences() != null) {
            Optional<LearningStyle> preferred = LearningStyle.fromLabel(profile.learningPreferences().style());
            if (preferred.isPresent()) return preferred.get();
        }

        return inferLearningStyle(profile);
    }

    private LearningStyle inferLearningStyle(LearnerProfile profile) {
        if (profile == null || profile.contentPreferences() == null) return LearningStyle.MIXED;

        LearningStyle best = null;
        double bestWeight = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : new TreeMap<>(profile.contentPreferences()).entrySet()) {
            Optional<LearningStyle> style = LearningStyle.fromLabel(e.getKey());
            if (style.isEmpty() || e.getValue() == null || e.getValue().isNaN()) continue;
            if (e.getValue() > bestWeight) {
                best = style.get();
                bestWeight = e.getValue();
            }
        }
        return best == null ? LearningStyle.MIXED : best;
    }

    private SocialContext socialContext(Map<String, String> signals) {
        int groupSize = 1;
        String rawGroupSize = RequestSignals.value(signals, RequestSignals.GROUP_SIZE);
        if (rawGroupSize != null) {
            try {
                groupSize = Math.max(1, Integer.parseInt(rawGroupSize));
            } catch (NumberFormatException e) {
                log.debug("Unparseable group-size signal '{}', using 1", rawGroupSize);
            }
        }
        return new SocialContext(
                groupSize,
                Optional.ofNullable(RequestSignals.value(signals, RequestSignals.INTERACTION_TYPE)).orElse("individual"),
                RequestSignals.flag(signals, RequestSignals.COLLABORATION),
                RequestSignals.flag(signals, RequestSignals.PEER_LEARNING),
                RequestSignals.flag(signals, RequestSignals.MENTORING),
                RequestSignals.flag(signals, RequestSignals.COMPETITION));
    }

    private TechnologyLevel technologyLevel(Map<String, String> signals, LearnerProfile profile) {
        String userAgent = Optional.ofNullable(RequestSignals.value(signals, RequestSignals.USER_AGENT)).orElse("");
        String connectionSpeed = Optional.ofNullable(RequestSignals.value(signals, RequestSignals.CONNECTION_SPEED))
                .map(s -> s.toLowerCase(Locale.ROOT))
                .orElse("unknown");
        String device = detectDevice(userAgent);
        String comfort = profile == null || profile.technologyComfort() == null ? "medium" : profile.technologyComfort();

        return new TechnologyLevel(device, detectBrowser(userAgent), detectOs(userAgent), connectionSpeed, comfort,
                availableFeatures(device, connectionSpeed));
    }

    private LanguagePreferences languagePreferences(Map<String, String> signals, LearnerProfile profile) {
        LanguageProfile language = profile == null ? null : profile.language();
        String primary = firstNonBlank(RequestSignals.value(signals, RequestSignals.LANGUAGE),
                language == null ? null : language.primary(), "en");
        String secondary = language == null || language.secondary() == null || language.secondary().isBlank()
                ? null : language.secondary();
        String fluency = firstNonBlank(language == null ? null : language.fluency(), "native");

        return new LanguagePreferences(primary, secondary, fluency,
                RequestSignals.flag(signals, RequestSignals.TRANSLATION), secondary != null);
    }

    private CulturalContext culturalContext(Map<String, String> signals, LearnerProfile profile) {
        CulturalProfile cultural = profile == null ? null : profile.cultural();
        return new CulturalContext(
                firstNonBlank(RequestSignals.value(signals, RequestSignals.LOCATION), profile == null ? null : profile.location(), "unknown"),
                firstNonBlank(cultural == null ? null : cultural.background(), "general"),
                firstNonBlank(RequestSignals.value(signals, RequestSignals.TIMEZONE), profile == null ? null : profile.timezone(), "UTC"),
                cultural == null || cultural.holidays() == null ? List.of() : List.copyOf(cultural.holidays()),
                firstNonBlank(cultural == null ? null : cultural.educationalValues(), "universal"));
    }

    private String detectDevice(String userAgent) {
        boolean mobile = userAgent.matches("(?s).*(Mobile|Android|iPhone|iPad).*");
        boolean tablet = userAgent.matches("(?s).*(Tablet|iPad).*");
        if (mobile) return "mobile";
        if (tablet) return "tablet";
        return "desktop";
    }

    private String detectBrowser(String userAgent) {
        if (userAgent.contains("Chrome")) return "Chrome";
        if (userAgent.contains("Firefox")) return "Firefox";
        if (userAgent.contains("Safari")) return "Safari";
        if (userAgent.contains("Edge")) return "Edge";
        return "Unknown";
    }

    private String detectOs(String userAgent) {
        if (userAgent.contains("Windows")) return "Windows";
        if (userAgent.contains("Mac OS")) return "macOS";
        if (userAgent.contains("Linux")) return "Linux";
        if (userAgent.contains("Android")) return "Android";
        if (userAgent.contains("iOS")) return "iOS";
        return "Unknown";
    }

    private List<String> availableFeatures(String device, String connectionSpeed) {
        List<String> features = new ArrayList<>();
        if ("desktop".equals(device)) {
            features.addAll(List.of("keyboard-navigation", "mouse-interaction", "full-screen"));
        }
        if ("mobile".equals(device)) {
            features.addAll(List.of("touch-interface", "gesture-navigation", "mobile-optimized"));
        }
        if ("fast".equals(connectionSpeed)) {
            features.addAll(List.of("high-quality-video", "real-time-interaction", "complex-graphics"));
        } else if ("slow".equals(connectionSpeed)) {
            features.addAll(List.of("low-bandwidth-mode", "caching", "progressive-loading"));
        }
        return List.copyOf(features);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
