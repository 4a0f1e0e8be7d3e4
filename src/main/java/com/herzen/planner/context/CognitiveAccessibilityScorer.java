package com.herzen.planner.context;

import com.herzen.planner.context.ContextModels.AccessibilityNeed;
import com.herzen.planner.context.ContextModels.AccessibilityNeeds;
import com.herzen.planner.context.ContextModels.CognitiveLoad;
import com.herzen.planner.context.ContextModels.CognitiveLoadLevel;
import com.herzen.planner.context.ContextModels.LoadFactors;
import com.herzen.planner.context.ContextModels.Severity;
import com.herzen.planner.domain.DomainModels.CognitiveCharacteristics;
import com.herzen.planner.domain.DomainModels.LearnerProfile;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class CognitiveAccessibilityScorer {
    static final double NEUTRAL_FACTOR = 0.5;

    public CognitiveLoad cognitiveLoad(Map<String, String> signals, LearnerProfile profile) {
        CognitiveCharacteristics cognitive = profile == null ? null : profile.cognitiveCharacteristics();

        LoadFactors factors = new LoadFactors(
                factor(parseDouble(RequestSignals.value(signals, RequestSignals.COMPLEXITY))),
                factor(profile == null ? null : profile.priorKnowledge()),
                factor(cognitive == null ? null : cognitive.workingMemory()),
                factor(cognitive == null ? null : cognitive.processingSpeed()));

        return new CognitiveLoad(CognitiveLoadLevel.of(factors.average()), factors, loadRecommendations(factors));
    }

    public AccessibilityNeeds accessibilityNeeds(Map<String, String> signals, LearnerProfile profile) {
        Set<AccessibilityNeed> needs = new LinkedHashSet<>();
        for (AccessibilityNeed need : AccessibilityNeed.values()) {
            if (RequestSignals.flag(signals, need.signal())) needs.add(need);
        }
        if (profile != null && profile.accessibilityNeeds() != null) {
            profile.accessibilityNeeds().stream()
                    .map(AccessibilityNeed::fromLabel)
                    .flatMap(Optional::stream)
                    .forEach(needs::add);
        }

        Set<String> technology = new LinkedHashSet<>();
        Set<String> accommodations = new LinkedHashSet<>();
        needs.forEach(n -> {
            technology.addAll(n.assistiveTechnology());
            accommodations.addAll(n.accommodations());
        });

        return new AccessibilityNeeds(
                Collections.unmodifiableSet(needs),
                Severity.of(needs.size()),
                Collections.unmodifiableSet(technology),
                Collections.unmodifiableSet(accommodations));
    }

    private List<String> loadRecommendations(LoadFactors factors) {
        List<String> recommendations = new ArrayList<>();
        if (factors.complexity() > 0.7) {
            recommendations.add("Reduce content complexity");
        }
        if (factors.workingMemory() < 0.4) {
            recommendations.add("Break information into smaller chunks");
        }
        if (factors.priorKnowledge() < 0.3) {
            recommendations.add("Provide more background information");
        }
        return List.copyOf(recommendations);
    }

    private double factor(Double raw) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) return NEUTRAL_FACTOR;
        return Math.max(0.0, Math.min(1.0, raw));
    }

    private Double parseDouble(String raw) {
        if (raw == null) return null;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
