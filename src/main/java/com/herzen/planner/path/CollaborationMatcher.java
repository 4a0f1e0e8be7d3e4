package com.herzen.planner.path;

import com.herzen.planner.path.PathModels.CollaborationOpportunity;
import com.herzen.planner.path.PathModels.GroupSize;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class CollaborationMatcher {
    static final List<String> COLLABORATIVE_KEYWORDS = List.of("discussion", "group", "team", "collaborative", "peer");
    static final double SCORE_PER_KEYWORD = 0.3;
    static final double OPPORTUNITY_THRESHOLD = 0.7;

    private static final List<String> BASE_ROLES = List.of("facilitator", "recorder", "timekeeper", "presenter");

    public List<CollaborationOpportunity> opportunities(List<String> objectives) {
        List<CollaborationOpportunity> out = new ArrayList<>();
        for (int i = 0; i < objectives.size(); i++) {
            String objective = objectives.get(i);
            double score = collaborationScore(objective);
            if (score > OPPORTUNITY_THRESHOLD) {
                out.add(new CollaborationOpportunity(i, objective, score,
                        suggestedActivities(objective), groupSize(objective), roles(objective)));
            }
        }
        return List.copyOf(out);
    }

    public double collaborationScore(String objective) {
        String text = normalize(objective);
        long matches = COLLABORATIVE_KEYWORDS.stream().filter(text::contains).count();
        return Math.min(matches * SCORE_PER_KEYWORD, 1.0);
    }

    List<String> suggestedActivities(String objective) {
        String text = normalize(objective);
        if (text.contains("discussion")) return List.of("debate", "round-robin", "fishbowl");
        if (text.contains("problem-solving")) return List.of("jigsaw", "think-pair-share", "group-investigation");
        if (text.contains("creation")) return List.of("collaborative-project", "peer-review", "group-presentation");
        return List.of("discussion", "peer-learning", "study-group");
    }

    GroupSize groupSize(String objective) {
        String text = normalize(objective);
        if (text.contains("discussion")) return new GroupSize(3, 6);
        if (text.contains("project")) return new GroupSize(4, 8);
        return new GroupSize(2, 4);
    }

    List<String> roles(String objective) {
        if (!normalize(objective).contains("technical")) return BASE_ROLES;
        List<String> roles = new ArrayList<>(BASE_ROLES);
        roles.add("technical-expert");
        roles.add("quality-checker");
        return List.copyOf(roles);
    }

    private String normalize(String objective) {
        return objective == null ? "" : objective.toLowerCase(Locale.ROOT);
    }
}
