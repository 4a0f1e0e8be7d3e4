package com.herzen.planner.context;

import java.util.Map;
import java.util.Set;

public final class RequestSignals {
    public static final String CONTEXT = "context";
    public static final String PATH = "path";

    public static final String SPECIAL_NEEDS = "special-needs";
    public static final String GIFTED = "gifted";
    public static final String ESL = "esl";
    public static final String REMOTE = "remote";
    public static final String BLENDED = "blended";

    public static final String LEARNING_STYLE = "learning-style";
    public static final String COMPLEXITY = "complexity";

    public static final String VISUAL_IMPAIRMENT = "visual-impairment";
    public static final String HEARING_IMPAIRMENT = "hearing-impairment";
    public static final String MOTOR_IMPAIRMENT = "motor-impairment";
    public static final String COGNITIVE_IMPAIRMENT = "cognitive-impairment";

    public static final String GROUP_SIZE = "group-size";
    public static final String INTERACTION_TYPE = "interaction-type";
    public static final String COLLABORATION = "collaboration";
    public static final String PEER_LEARNING = "peer-learning";
    public static final String MENTORING = "mentoring";
    public static final String COMPETITION = "competition";

    public static final String USER_AGENT = "user-agent";
    public static final String CONNECTION_SPEED = "connection-speed";
    public static final String LANGUAGE = "language";
    public static final String TRANSLATION = "translation";
    public static final String LOCATION = "location";
    public static final String TIMEZONE = "timezone";

    public static final Set<String> SUPPORTED = Set.of(
            CONTEXT, PATH,
            SPECIAL_NEEDS, GIFTED, ESL, REMOTE, BLENDED,
            LEARNING_STYLE, COMPLEXITY,
            VISUAL_IMPAIRMENT, HEARING_IMPAIRMENT, MOTOR_IMPAIRMENT, COGNITIVE_IMPAIRMENT,
            GROUP_SIZE, INTERACTION_TYPE, COLLABORATION, PEER_LEARNING, MENTORING, COMPETITION,
            USER_AGENT, CONNECTION_SPEED, LANGUAGE, TRANSLATION, LOCATION, TIMEZONE
    );

    private RequestSignals() {}

    static String value(Map<String, String> signals, String key) {
        if (signals == null) return null;
        String v = signals.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    static boolean flag(Map<String, String> signals, String key) {
        return "true".equalsIgnoreCase(value(signals, key));
    }
}
