package com.herzen.planner.path;

import com.herzen.planner.config.PlanningProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class RandomPathIdGenerator implements PathIdGenerator {
    private final String prefix;

    public RandomPathIdGenerator(PlanningProperties properties) {
        this.prefix = properties.pathIdPrefix();
    }

    @Override
    public String nextId() {
        return prefix + "_" + UUID.randomUUID();
    }
}
