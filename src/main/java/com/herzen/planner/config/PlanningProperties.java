package com.herzen.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "planning")
public record PlanningProperties(@DefaultValue("path") String pathIdPrefix,
                                 @DefaultValue("true") boolean auditLogEnabled,
                                 @DefaultValue("20") int recentPlansLimit) {
}
